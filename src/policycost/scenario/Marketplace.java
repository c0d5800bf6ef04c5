package policycost.scenario;

/**
 * Market price conventions shared with the scenario model.
 */
public final class Marketplace {

    private Marketplace() {}

    /** Returned by a price lookup when no market exists for the good. */
    public static final double NO_MARKET_PRICE = Double.MAX_VALUE;

    public static boolean isNoMarket(double price) {
        return price == NO_MARKET_PRICE;
    }
}
