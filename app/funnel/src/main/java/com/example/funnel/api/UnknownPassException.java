package com.example.funnel.api;

public class UnknownPassException extends RuntimeException {

  public UnknownPassException(String pass) {
    super("unknown pass: " + pass);
  }
}
