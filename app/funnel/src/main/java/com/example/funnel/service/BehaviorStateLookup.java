/*
 * Where: Funnel service layer
 * What: On-demand behavioral predicates consulted by compound triggers
 * Why: Trigger evaluation depends on this seam, not on product tables directly
 */
package com.example.funnel.service;

public interface BehaviorStateLookup {

  boolean hasSmartLink(String userId);

  boolean hasUsedAi(String userId);

  boolean hasCalendarConnected(String userId);

  boolean hasAdCampaign(String userId);
}
