package com.flamingo.ai.foodscout.domain.model;

import java.util.List;

/** Point-of-interest details from the map collaborator. */
public record PoiRecord(
    String name,
    String address,
    String phone,
    Double rating,
    List<String> photos,
    List<String> tags) {}
