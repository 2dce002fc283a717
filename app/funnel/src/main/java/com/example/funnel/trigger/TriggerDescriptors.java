/*
 * Where: Funnel trigger model
 * What: Parses catalog trigger strings such as "no_smart_link_after_24h"
 * Why: The catalog keeps the readable legacy keys while evaluation works on typed triggers
 */
package com.example.funnel.trigger;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TriggerDescriptors {

  private static final String SIGNUP_COMPLETED = "signup_completed";
  private static final Pattern DAYS_SINCE_SIGNUP = Pattern.compile("days_since_signup_(\\d{1,4})");
  private static final Pattern USER_ACTIVE = Pattern.compile("user_active_(\\d{1,4})d");
  private static final Pattern NO_LOGIN = Pattern.compile("no_login_(\\d{1,4})d");
  private static final Pattern FREE_PLAN =
      Pattern.compile("(?:free_plan_|free_user_no_upgrade_|low_ai_credits_)(\\d{1,4})d");
  private static final Pattern WITHOUT_FLAG =
      Pattern.compile("no_(smart_link|ai_usage|calendar|ad_campaign)_after_(\\d{1,4})(h|d)");
  private static final Pattern WITH_FLAG =
      Pattern.compile("has_(smart_link|ai_usage|calendar|ad_campaign)_(\\d{1,4})d");

  private static final Map<String, BehaviorFlag> FLAG_NAMES =
      Map.of(
          "smart_link", BehaviorFlag.HAS_SMART_LINK,
          "ai_usage", BehaviorFlag.HAS_USED_AI,
          "calendar", BehaviorFlag.HAS_CALENDAR_CONNECTED,
          "ad_campaign", BehaviorFlag.HAS_AD_CAMPAIGN);

  private TriggerDescriptors() {}

  public static Trigger parse(String descriptor) {
    if (descriptor == null || descriptor.isBlank()) {
      return new Trigger.Unrecognized(String.valueOf(descriptor));
    }
    final String value = descriptor.trim().toLowerCase(Locale.ROOT);
    if (SIGNUP_COMPLETED.equals(value)) {
      return new Trigger.AlwaysTrue();
    }
    Matcher matcher = DAYS_SINCE_SIGNUP.matcher(value);
    if (matcher.matches()) {
      return new Trigger.ElapsedDays(Integer.parseInt(matcher.group(1)));
    }
    matcher = USER_ACTIVE.matcher(value);
    if (matcher.matches()) {
      return new Trigger.ElapsedDays(Integer.parseInt(matcher.group(1)));
    }
    matcher = NO_LOGIN.matcher(value);
    if (matcher.matches()) {
      return new Trigger.InactivityDays(Integer.parseInt(matcher.group(1)));
    }
    matcher = FREE_PLAN.matcher(value);
    if (matcher.matches()) {
      return new Trigger.CompoundNegative(
          new Trigger.ElapsedDays(Integer.parseInt(matcher.group(1))), BehaviorFlag.ON_PAID_PLAN);
    }
    matcher = WITHOUT_FLAG.matcher(value);
    if (matcher.matches()) {
      final Integer days = wholeDays(matcher.group(2), matcher.group(3));
      if (days == null) {
        return new Trigger.Unrecognized(descriptor);
      }
      return new Trigger.CompoundNegative(
          new Trigger.ElapsedDays(days), FLAG_NAMES.get(matcher.group(1)));
    }
    matcher = WITH_FLAG.matcher(value);
    if (matcher.matches()) {
      return new Trigger.CompoundPositive(
          new Trigger.ElapsedDays(Integer.parseInt(matcher.group(2))),
          FLAG_NAMES.get(matcher.group(1)));
    }
    return new Trigger.Unrecognized(descriptor);
  }

  // "24h" and "1d" both mean one day; hour counts that are not whole days are rejected.
  private static Integer wholeDays(String amount, String unit) {
    final int value = Integer.parseInt(amount);
    if ("h".equals(unit)) {
      return value % 24 == 0 ? value / 24 : null;
    }
    return value;
  }
}
