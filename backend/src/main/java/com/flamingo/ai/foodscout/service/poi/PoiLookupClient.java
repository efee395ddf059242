package com.flamingo.ai.foodscout.service.poi;

import com.flamingo.ai.foodscout.domain.model.PoiRecord;
import java.util.Optional;

/** Client contract for the map / point-of-interest collaborator. */
public interface PoiLookupClient {

  /**
   * Looks up a shop.
   *
   * @param cityHint location text used to disambiguate shops sharing a name
   * @return empty when no match was found
   */
  Optional<PoiRecord> lookup(String name, String cityHint);
}
