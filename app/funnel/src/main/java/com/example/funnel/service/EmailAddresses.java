package com.example.funnel.service;

import java.util.Locale;

/** Helpers for putting recipient addresses into logs. */
public final class EmailAddresses {

  private EmailAddresses() {}

  /** "jane.doe@example.com" becomes "j***@example.com". */
  public static String mask(String email) {
    if (email == null || email.isBlank()) {
      return "";
    }
    final int at = email.indexOf('@');
    if (at <= 0) {
      return "***";
    }
    return email.charAt(0) + "***" + email.substring(at).toLowerCase(Locale.ROOT);
  }
}
