package io.intellixity.scoped.carrier;

/**
 * Holder of the process-wide {@link Carrier}.\n
 *
 * The carrier is chosen by {@link CarrierSelector#select()} on first access and fixed for the
 * lifetime of the class loader. Although it is a single instance, its content is per thread; see
 * {@link Carrier}.\n
 */
public final class Carriers {
  private Carriers() {}

  private static final class Holder {
    static final Carrier CARRIER = CarrierSelector.select();
  }

  public static Carrier carrier() {
    return Holder.CARRIER;
  }
}
