package com.flamingo.ai.foodscout.domain.model;

import com.flamingo.ai.foodscout.domain.enums.MessageRole;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;

/**
 * Per-session conversation state, touched only by the turn currently running for that session.
 *
 * <p>{@code recommendations} holds every shop known to the conversation: the first search's set
 * plus anything added by later expansions. Category and location filters narrow the working set
 * from that full map; expansion adds to the working set. Excluded shops are hidden from every view.
 */
public class ConversationContext {

  private final List<MessageEntry> messages = new ArrayList<>();

  private final Map<String, RestaurantRecommendation> recommendations = new LinkedHashMap<>();

  private final List<String> workingSet = new ArrayList<>();

  private final List<String> excludedShops = new ArrayList<>();

  private final Set<String> lastDocumentIds = new LinkedHashSet<>();

  @Getter @Setter private SearchIntent lastIntent;

  @Getter @Setter private int turnCount;

  public List<MessageEntry> getMessages() {
    return Collections.unmodifiableList(messages);
  }

  /** Every known shop keyed by normalized name. Read-only. */
  public Map<String, RestaurantRecommendation> getRecommendations() {
    return Collections.unmodifiableMap(recommendations);
  }

  /** Normalized names in the working set, in display order. Read-only. */
  public List<String> getWorkingSet() {
    return Collections.unmodifiableList(workingSet);
  }

  public List<String> getExcludedShops() {
    return Collections.unmodifiableList(excludedShops);
  }

  public Set<String> getLastDocumentIds() {
    return Collections.unmodifiableSet(lastDocumentIds);
  }

  public void addMessage(MessageRole role, String content) {
    messages.add(new MessageEntry(role, content));
  }

  /** The last {@code window} messages as "ROLE: text" lines, oldest first. */
  public String transcript(int window) {
    StringBuilder sb = new StringBuilder();
    for (MessageEntry message :
        messages.subList(Math.max(0, messages.size() - window), messages.size())) {
      sb.append(message.role().name()).append(": ").append(message.content()).append("\n");
    }
    return sb.length() == 0 ? "(no earlier messages)" : sb.toString();
  }

  public boolean hasRecommendations() {
    return !recommendations.isEmpty();
  }

  /** Replaces all known shops with a fresh search result. */
  public void replaceRecommendations(Collection<RestaurantRecommendation> fresh) {
    recommendations.clear();
    workingSet.clear();
    for (RestaurantRecommendation recommendation : fresh) {
      String key = ShopNames.normalize(recommendation.getName());
      if (recommendations.putIfAbsent(key, recommendation) == null) {
        workingSet.add(key);
      }
    }
  }

  /**
   * Adds shops not already known, appending them to the working set.
   *
   * @return the shops actually added
   */
  public List<RestaurantRecommendation> mergeNew(Collection<RestaurantRecommendation> candidates) {
    List<RestaurantRecommendation> added = new ArrayList<>();
    for (RestaurantRecommendation candidate : candidates) {
      String key = ShopNames.normalize(candidate.getName());
      if (!recommendations.containsKey(key)) {
        recommendations.put(key, candidate);
        workingSet.add(key);
        added.add(candidate);
      }
    }
    return added;
  }

  /** Narrows the working set to the given shops, which must already be known. */
  public void scopeTo(Collection<RestaurantRecommendation> scope) {
    workingSet.clear();
    for (RestaurantRecommendation recommendation : scope) {
      String key = ShopNames.normalize(recommendation.getName());
      if (recommendations.containsKey(key) && !workingSet.contains(key)) {
        workingSet.add(key);
      }
    }
  }

  public void exclude(String shopName) {
    if (!excludedShops.contains(shopName)) {
      excludedShops.add(shopName);
    }
  }

  public boolean isExcluded(String shopName) {
    return ShopNames.matchesAny(shopName, excludedShops);
  }

  /** Shops in the working set that are neither excluded nor filtered. */
  public List<RestaurantRecommendation> visible() {
    List<RestaurantRecommendation> result = new ArrayList<>();
    for (String key : workingSet) {
      RestaurantRecommendation recommendation = recommendations.get(key);
      if (recommendation != null
          && recommendation.isRecommended()
          && !isExcluded(recommendation.getName())) {
        result.add(recommendation);
      }
    }
    return result;
  }

  /** Every known recommended shop that is not excluded, in discovery order. */
  public List<RestaurantRecommendation> all() {
    List<RestaurantRecommendation> result = new ArrayList<>();
    for (RestaurantRecommendation recommendation : recommendations.values()) {
      if (recommendation.isRecommended() && !isExcluded(recommendation.getName())) {
        result.add(recommendation);
      }
    }
    return result;
  }

  public void rememberDocuments(Collection<String> documentIds) {
    lastDocumentIds.addAll(documentIds);
  }

  /** Clears search results while keeping the message log and exclusions. */
  public void resetSearch(SearchIntent intent, Collection<String> documentIds) {
    this.lastIntent = intent;
    lastDocumentIds.clear();
    lastDocumentIds.addAll(documentIds);
  }

  public void incrementTurn() {
    turnCount++;
  }
}
