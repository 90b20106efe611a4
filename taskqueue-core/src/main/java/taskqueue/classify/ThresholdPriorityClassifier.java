package taskqueue.classify;

import taskqueue.Priority;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies by identifier and amount.
 *
 * <ul>
 *   <li>{@link Priority#HIGH} if the identifier attribute is one of the high-value
 *       identifiers, or the amount is above the high threshold</li>
 *   <li>{@link Priority#MEDIUM} if the amount is above the medium threshold</li>
 *   <li>{@link Priority#LOW} otherwise, including when the amount is missing or not numeric</li>
 * </ul>
 *
 * <p>Amounts may be any {@link Number} or a numeric string.
 */
public final class ThresholdPriorityClassifier implements PriorityClassifier {
  public static final String DEFAULT_ID_ATTRIBUTE = "customerId";
  public static final String DEFAULT_AMOUNT_ATTRIBUTE = "amount";

  private final Set<String> highValueIds;
  private final BigDecimal highThreshold;
  private final BigDecimal mediumThreshold;
  private final String idAttribute;
  private final String amountAttribute;

  private ThresholdPriorityClassifier(Builder builder) {
    this.highValueIds = Set.copyOf(builder.highValueIds);
    this.highThreshold = Objects.requireNonNull(builder.highThreshold, "highThreshold");
    this.mediumThreshold = Objects.requireNonNull(builder.mediumThreshold, "mediumThreshold");
    this.idAttribute = Objects.requireNonNull(builder.idAttribute, "idAttribute");
    this.amountAttribute = Objects.requireNonNull(builder.amountAttribute, "amountAttribute");
    if (mediumThreshold.compareTo(highThreshold) > 0) {
      throw new IllegalArgumentException("mediumThreshold must not exceed highThreshold");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Priority classify(Map<String, ?> attributes) {
    Object id = attributes.get(idAttribute);
    if (id != null && highValueIds.contains(id.toString())) {
      return Priority.HIGH;
    }
    BigDecimal amount = toAmount(attributes.get(amountAttribute));
    if (amount == null) {
      return Priority.LOW;
    }
    if (amount.compareTo(highThreshold) > 0) {
      return Priority.HIGH;
    }
    if (amount.compareTo(mediumThreshold) > 0) {
      return Priority.MEDIUM;
    }
    return Priority.LOW;
  }

  private static BigDecimal toAmount(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof BigDecimal decimal) {
      return decimal;
    }
    try {
      return new BigDecimal(value.toString().trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Builder for {@link ThresholdPriorityClassifier}. */
  public static final class Builder {
    private Set<String> highValueIds = Set.of();
    private BigDecimal highThreshold = new BigDecimal("10000");
    private BigDecimal mediumThreshold = new BigDecimal("1000");
    private String idAttribute = DEFAULT_ID_ATTRIBUTE;
    private String amountAttribute = DEFAULT_AMOUNT_ATTRIBUTE;

    private Builder() {}

    /**
     * Sets the identifiers whose tasks always go to the HIGH lane.
     *
     * <p>Optional. Defaults to none.
     *
     * @param highValueIds the identifiers
     * @return this builder
     */
    public Builder highValueIds(Set<String> highValueIds) {
      this.highValueIds = Objects.requireNonNull(highValueIds, "highValueIds");
      return this;
    }

    /**
     * Sets the amount above which a task is HIGH.
     *
     * <p>Optional. Defaults to {@code 10000}.
     *
     * @param highThreshold the threshold
     * @return this builder
     */
    public Builder highThreshold(BigDecimal highThreshold) {
      this.highThreshold = highThreshold;
      return this;
    }

    /**
     * Sets the amount above which a task is MEDIUM.
     *
     * <p>Optional. Defaults to {@code 1000}. Must not exceed the high threshold.
     *
     * @param mediumThreshold the threshold
     * @return this builder
     */
    public Builder mediumThreshold(BigDecimal mediumThreshold) {
      this.mediumThreshold = mediumThreshold;
      return this;
    }

    /**
     * Sets the attribute holding the identifier.
     *
     * <p>Optional. Defaults to {@value ThresholdPriorityClassifier#DEFAULT_ID_ATTRIBUTE}.
     *
     * @param idAttribute the attribute name
     * @return this builder
     */
    public Builder idAttribute(String idAttribute) {
      this.idAttribute = idAttribute;
      return this;
    }

    /**
     * Sets the attribute holding the amount.
     *
     * <p>Optional. Defaults to {@value ThresholdPriorityClassifier#DEFAULT_AMOUNT_ATTRIBUTE}.
     *
     * @param amountAttribute the attribute name
     * @return this builder
     */
    public Builder amountAttribute(String amountAttribute) {
      this.amountAttribute = amountAttribute;
      return this;
    }

    public ThresholdPriorityClassifier build() {
      return new ThresholdPriorityClassifier(this);
    }
  }
}
