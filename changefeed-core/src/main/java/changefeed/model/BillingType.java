package changefeed.model;

/**
 * Billing classification attached to a package. Codes match the values stored in the
 * {@code packages.billing_type} column.
 */
public enum BillingType {
  NO_COST(0),
  BILL_ONCE_ONLY(1),
  BILL_MONTHLY(2),
  PROOF_OF_PREPURCHASE_ONLY(3),
  GUEST_PASS(4),
  HARDWARE_PROMO(5),
  GIFT(6),
  AUTO_GRANT(7),
  OEM_TICKET(8),
  RECURRING_OPTION(9),
  BILL_ONCE_OR_CD_KEY(10),
  REPURCHASEABLE(11),
  FREE_ON_DEMAND(12),
  RENTAL(13),
  COMMERCIAL_LICENSE(14),
  FREE_COMMERCIAL_LICENSE(15);

  private final int code;

  BillingType(int code) {
    this.code = code;
  }

  /**
   * Resolves a stored code.
   *
   * @return the billing type, or {@code null} for codes this version does not know
   */
  public static BillingType fromCode(int code) {
    for (BillingType type : values()) {
      if (type.code == code) {
        return type;
      }
    }
    return null;
  }
}
