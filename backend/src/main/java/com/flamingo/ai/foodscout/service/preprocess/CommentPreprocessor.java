package com.flamingo.ai.foodscout.service.preprocess;

import com.flamingo.ai.foodscout.config.ScoutConfig;
import com.flamingo.ai.foodscout.domain.model.NormalizedCommentUnit;
import com.flamingo.ai.foodscout.domain.model.RawComment;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns raw comments into normalized units with a deterministic engagement coefficient.
 *
 * <p>Engagement comes from the explicit count when the source reports one, otherwise from inline
 * markup such as {@code [112赞]}, {@code [1.2k赞]}, {@code [3万赞]} or {@code [45 likes]}. The markup
 * is removed from the stored text either way.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommentPreprocessor {

  private static final BigDecimal MAX_LIKES = BigDecimal.valueOf(Integer.MAX_VALUE);

  private static final Pattern ENGAGEMENT_MARKUP =
      Pattern.compile(
          "\\[\\s*(\\d+(?:\\.\\d+)?)\\s*([kKwW万])?\\s*(?:赞|likes?)\\s*\\]",
          Pattern.CASE_INSENSITIVE);

  private final ScoutConfig scoutConfig;

  /**
   * Normalizes comments in order, skipping blank ones, keeping at most the configured maximum.
   * Unit ids are {@code c<position in the raw list>}.
   */
  public List<NormalizedCommentUnit> preprocess(List<RawComment> comments) {
    int max = scoutConfig.getPreprocessing().getMaxComments();
    List<NormalizedCommentUnit> units = new ArrayList<>();
    if (comments == null) {
      return units;
    }

    for (int i = 0; i < comments.size() && units.size() < max; i++) {
      RawComment comment = comments.get(i);
      if (comment == null || comment.text() == null || comment.text().isBlank()) {
        continue;
      }

      ExtractedEngagement extracted = extractEngagement(comment.text());
      int likes = comment.likes() != null ? Math.max(0, comment.likes()) : extracted.likes();
      int subComments =
          comment.subCommentCount() != null ? Math.max(0, comment.subCommentCount()) : 0;
      String text = extracted.text().isEmpty() ? comment.text().strip() : extracted.text();

      units.add(
          new NormalizedCommentUnit(
              "c" + i, text, likes, subComments, engagementCoefficient(likes, subComments)));
    }

    log.debug("Preprocessed {} of {} comments", units.size(), comments.size());
    return units;
  }

  /**
   * Step function over engagement: above 50 gives 2.0, 20 to 50 gives 1.5, 5 to 19 gives 1.2,
   * anything lower 1.0. More than 10 sub-comments multiplies the result by 1.5.
   */
  public static double engagementCoefficient(int likes, int subCommentCount) {
    double base;
    if (likes > 50) {
      base = 2.0;
    } else if (likes >= 20) {
      base = 1.5;
    } else if (likes >= 5) {
      base = 1.2;
    } else {
      base = 1.0;
    }
    if (subCommentCount > 10) {
      base *= 1.5;
    }
    return base;
  }

  /** Reads the first engagement marker in the text and strips every marker. */
  public static ExtractedEngagement extractEngagement(String text) {
    if (text == null) {
      return new ExtractedEngagement("", 0);
    }
    Matcher matcher = ENGAGEMENT_MARKUP.matcher(text);
    if (!matcher.find()) {
      return new ExtractedEngagement(text.strip(), 0);
    }

    BigDecimal value = new BigDecimal(matcher.group(1));
    String suffix = matcher.group(2);
    if (suffix != null) {
      String unit = suffix.toLowerCase(Locale.ROOT);
      value = value.multiply(BigDecimal.valueOf(unit.equals("k") ? 1_000 : 10_000));
    }

    String cleaned = ENGAGEMENT_MARKUP.matcher(text).replaceAll("").strip();
    // Saturates rather than wrapping on absurd counts.
    return new ExtractedEngagement(cleaned, value.min(MAX_LIKES).intValue());
  }

  /** Text with markup removed and the engagement count it carried. */
  public record ExtractedEngagement(String text, int likes) {}
}
