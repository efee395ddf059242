package com.flamingo.ai.foodscout.domain.enums;

/** What a conversation turn asks the service to do. */
public enum FollowUpType {
  NEW_SEARCH,
  CATEGORY_FILTER,
  LOCATION_FILTER,
  EXCLUDE_FILTER,
  EXPAND,
  DETAIL,
  CONFIRM
}
