package ember.utils;

/**
 * Source of wall-clock time in epoch milliseconds. Expiration checks go through this so
 * tests can move time forward without sleeping.
 */
public interface Clock {
    Clock SYSTEM = System::currentTimeMillis;

    long currentTimeMillis();
}
