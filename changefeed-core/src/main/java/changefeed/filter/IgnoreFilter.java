package changefeed.filter;

import changefeed.model.BillingType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a changed package is left out of the refresh fan-out.
 *
 * <p>Suppression only affects refresh work: suppressed packages are still recorded in change
 * history.
 */
public final class IgnoreFilter {

  /** Billing classifications whose changes are noise for refresh purposes. */
  public static final Set<BillingType> IGNORED_BILLING_TYPES = Collections.unmodifiableSet(EnumSet.of(
      BillingType.PROOF_OF_PREPURCHASE_ONLY, // CD keys
      BillingType.GUEST_PASS,
      BillingType.HARDWARE_PROMO,
      BillingType.GIFT,
      BillingType.AUTO_GRANT,
      BillingType.OEM_TICKET,
      BillingType.RECURRING_OPTION));

  /** The platform's base package. */
  public static final int BASE_PACKAGE_ID = 0;

  /** Anonymous dedicated-server package. */
  public static final int ANONYMOUS_SERVER_PACKAGE_ID = 17906;

  public boolean shouldSuppress(int packageId, BillingType billingType) {
    return packageId == BASE_PACKAGE_ID
        || packageId == ANONYMOUS_SERVER_PACKAGE_ID
        || (billingType != null && IGNORED_BILLING_TYPES.contains(billingType));
  }

  /**
   * Returns the packages that are not suppressed, in input order.
   *
   * @param packageIds   changed packages
   * @param billingTypes known billing type per package; absent entries are never suppressed by type
   */
  public List<Integer> survivors(Collection<Integer> packageIds, Map<Integer, BillingType> billingTypes) {
    List<Integer> result = new ArrayList<>(packageIds.size());
    for (Integer id : packageIds) {
      if (!shouldSuppress(id, billingTypes.get(id))) {
        result.add(id);
      }
    }
    return result;
  }
}
