package com.flamingo.ai.foodscout.service.search;

import com.flamingo.ai.foodscout.config.ScoutConfig;
import com.flamingo.ai.foodscout.domain.enums.SearchStep;
import com.flamingo.ai.foodscout.domain.model.SearchIntent;
import com.flamingo.ai.foodscout.domain.model.SourceDocument;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Builds the query list for each search phase from configured templates. */
@Component
@RequiredArgsConstructor
public class QueryPlanner {

  private static final Pattern TITLE_SEPARATORS =
      Pattern.compile("[\\s,，。.!！?？、|｜/#@:：;；()（）【】\\[\\]\"“”'‘’~～]+");

  private final ScoutConfig scoutConfig;

  /**
   * Queries for one phase.
   *
   * @param earlierDocuments documents gathered so far; only the verification phase reads them
   * @return queries in execution order, empty when the phase does not apply
   */
  public List<String> plan(
      SearchStep step, SearchIntent intent, Collection<SourceDocument> earlierDocuments) {
    ScoutConfig.Search search = scoutConfig.getSearch();
    return switch (step) {
      case BROAD -> broadQueries(intent, search);
      case HIDDEN -> fill(search.getHiddenQueries(), intent, search.getHiddenWidth());
      case VERIFY -> verifyQueries(intent, earlierDocuments, search);
      case CATEGORY ->
          intent.hasFoodType() ? fill(search.getCategoryQueries(), intent, 2) : List.of();
      case EXPAND -> fill(search.getExpandQueries(), intent, search.getExpandQueries().size());
      default -> List.of();
    };
  }

  private List<String> broadQueries(SearchIntent intent, ScoutConfig.Search search) {
    Set<String> queries =
        new LinkedHashSet<>(fill(search.getBroadQueries(), intent, Integer.MAX_VALUE));
    for (String requirement : intent.requirements()) {
      if (requirement != null && !requirement.isBlank()) {
        queries.add(collapse(intent.location() + " " + requirement.strip()));
      }
    }
    return limit(new ArrayList<>(queries), search.getBroadWidth());
  }

  private List<String> verifyQueries(
      SearchIntent intent, Collection<SourceDocument> documents, ScoutConfig.Search search) {
    List<String> names = candidateShopNames(documents);
    List<String> queries = new ArrayList<>();
    int perQuery = Math.max(1, search.getNamesPerQuery());
    for (int i = 0; i < names.size(); i += perQuery) {
      List<String> group = names.subList(i, Math.min(i + perQuery, names.size()));
      queries.add(collapse(intent.location() + " " + String.join(" ", group)));
    }
    return queries;
  }

  /**
   * Title tokens that look like shop names: between 2 and 10 characters long and containing one of
   * the configured shop markers. Distinct, in order of appearance, capped at the configured limit.
   */
  public List<String> candidateShopNames(Collection<SourceDocument> documents) {
    ScoutConfig.Search search = scoutConfig.getSearch();
    Set<String> names = new LinkedHashSet<>();
    for (SourceDocument document : documents) {
      for (String token : TITLE_SEPARATORS.split(document.title())) {
        if (names.size() >= search.getCandidateNameLimit()) {
          return new ArrayList<>(names);
        }
        int length = token.codePointCount(0, token.length());
        if (length >= 2 && length <= 10 && containsMarker(token, search.getShopNameMarkers())) {
          names.add(token);
        }
      }
    }
    return new ArrayList<>(names);
  }

  private boolean containsMarker(String token, List<String> markers) {
    for (String marker : markers) {
      if (!token.equals(marker) && token.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  private List<String> fill(List<String> templates, SearchIntent intent, int width) {
    Set<String> queries = new LinkedHashSet<>();
    for (String template : templates) {
      String query =
          collapse(
              template
                  .replace("{location}", intent.location())
                  .replace("{food}", intent.foodType()));
      if (!query.isEmpty()) {
        queries.add(query);
      }
    }
    return limit(new ArrayList<>(queries), width);
  }

  private static List<String> limit(List<String> queries, int width) {
    return queries.size() > width ? new ArrayList<>(queries.subList(0, width)) : queries;
  }

  private static String collapse(String query) {
    return query.strip().replaceAll("\\s+", " ");
  }
}
