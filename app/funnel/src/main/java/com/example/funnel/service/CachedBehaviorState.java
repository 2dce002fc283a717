/*
 * Where: Funnel service layer
 * What: Per-user, per-pass memo of behavioral flags
 * Why: Several steps test the same flag; each is looked up at most once per pass
 */
package com.example.funnel.service;

import com.example.funnel.model.UserSnapshot;
import com.example.funnel.trigger.BehaviorFlag;
import java.util.EnumMap;
import java.util.Map;

public final class CachedBehaviorState {

  private final UserSnapshot user;
  private final BehaviorStateLookup lookup;
  private final Map<BehaviorFlag, Boolean> values = new EnumMap<>(BehaviorFlag.class);

  public CachedBehaviorState(UserSnapshot user, BehaviorStateLookup lookup) {
    this.user = user;
    this.lookup = lookup;
  }

  public boolean isSet(BehaviorFlag flag) {
    final Boolean cached = values.get(flag);
    if (cached != null) {
      return cached;
    }
    final boolean value =
        switch (flag) {
          case HAS_SMART_LINK -> lookup.hasSmartLink(user.id());
          case HAS_USED_AI -> lookup.hasUsedAi(user.id());
          case HAS_CALENDAR_CONNECTED -> lookup.hasCalendarConnected(user.id());
          case HAS_AD_CAMPAIGN -> lookup.hasAdCampaign(user.id());
          case ON_PAID_PLAN -> user.onPaidPlan();
        };
    values.put(flag, value);
    return value;
  }
}
