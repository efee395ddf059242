package com.flamingo.ai.foodscout.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the search, scoring and streaming pipeline. */
@Configuration
@ConfigurationProperties(prefix = "scout")
@Getter
@Setter
public class ScoutConfig {

  private Preprocessing preprocessing = new Preprocessing();
  private Scoring scoring = new Scoring();
  private Merge merge = new Merge();
  private Search search = new Search();
  private Stream stream = new Stream();
  private Memory memory = new Memory();
  private Poi poi = new Poi();
  private Source source = new Source();

  @Getter
  @Setter
  public static class Preprocessing {
    /** Maximum comment units kept per document. */
    private int maxComments = 30;
  }

  /**
   * Classification policy for aggregated shop scores. A shop is genuine when it has at least
   * {@code genuineStrongCount} strong-identity mentions and a total above {@code genuineTotal}.
   */
  @Getter
  @Setter
  public static class Scoring {
    private int genuineStrongCount = 2;
    private double genuineTotal = 10.0;
    private double genuineConfidence = 0.9;
    private int likelyGenuineStrongCount = 1;
    private double likelyGenuineTotal = 5.0;
    private double likelyGenuineConfidence = 0.75;
    private double likelyPromotedConfidence = 0.6;
    private double unknownConfidence = 0.5;
    private int topUnits = 5;
  }

  @Getter
  @Setter
  public static class Merge {
    private int lowCorroborationSources = 2;
    private double lowCorroborationFactor = 0.7;
    private int strongCorroborationSources = 3;
    private double strongCorroborationFactor = 1.2;
  }

  @Getter
  @Setter
  public static class Search {
    private int maxResultsPerQuery = 4;
    private String sort = "most_comments";
    private long queryTimeoutMs = 15000;
    private int phaseConcurrency = 4;
    private int analysisThreads = 4;
    private int searchThreads = 8;

    /** Skips the remaining phases once enough documents were gathered. */
    private boolean fastMode = false;

    private int fastModeThreshold = 12;

    private int broadWidth = 3;
    private int hiddenWidth = 4;
    private int candidateNameLimit = 4;
    private int namesPerQuery = 2;
    private int featureSnippets = 3;

    private List<String> broadQueries =
        new ArrayList<>(
            List.of(
                "{location} locals old shop",
                "{location} {food} authentic",
                "{location} locals recommend"));

    private List<String> hiddenQueries =
        new ArrayList<>(
            List.of(
                "{location} hole-in-the-wall tasty",
                "{location} small diner locals",
                "{location} alley old shop",
                "{location} unassuming tasty"));

    private List<String> categoryQueries =
        new ArrayList<>(List.of("{location} {food} old shop", "{location} {food} locals"));

    private List<String> expandQueries =
        new ArrayList<>(
            List.of(
                "{location} hidden gems",
                "{location} time-honored",
                "{location} street-side eatery"));

    /** Characters or words that mark a title token as a probable shop name. */
    private List<String> shopNameMarkers = new ArrayList<>(List.of("店", "馆"));
  }

  @Getter
  @Setter
  public static class Stream {
    private long heartbeatSeconds = 30;
    private long evictionMinutes = 30;
    private long evictionCheckMs = 60000;
  }

  @Getter
  @Setter
  public static class Memory {
    private long ttlMinutes = 60;
    private int historyWindow = 10;
    private int maxMessages = 50;
    private long maxSessions = 10000;
  }

  @Getter
  @Setter
  public static class Poi {
    private boolean enabled = true;
    private String baseUrl = "http://localhost:8091";
    private long timeoutMs = 5000;
    private long cacheSize = 2000;
    private long cacheTtlMinutes = 720;
  }

  @Getter
  @Setter
  public static class Source {
    private String baseUrl = "http://localhost:8090";
    private long timeoutMs = 15000;
  }
}
