package org.iceforge.cloudfiles.url;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Whether an attachment's URL is served over SSL. Either constant, or decided per record,
 * e.g. by a preference of the user that owns the attachment. Evaluated on every URL computation.
 *
 * @param <T> type of the record owning the attachment
 */
@FunctionalInterface
public interface SslPolicy<T> {

    boolean useSsl(T owner);

    static <T> SslPolicy<T> always() {
        return owner -> true;
    }

    static <T> SslPolicy<T> never() {
        return owner -> false;
    }

    static <T> SslPolicy<T> of(boolean ssl) {
        return ssl ? always() : never();
    }

    static <T> SslPolicy<T> when(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return predicate::test;
    }
}
