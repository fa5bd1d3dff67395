package io.github.eutro.charonj.api.bits;

/**
 * A reusable piece of translator behaviour, such as {@link OutputsToDirectory writing outputs},
 * installed with {@link io.github.eutro.charonj.api.CrateTranslator#add(Bit)}.
 * <p>
 * Installing a bit subscribes its listeners; the returned value is whatever handle the bit
 * offers, such as the {@link DiagnosticSummary} it keeps its counts in.
 *
 * @param <Onto> What this is installed on.
 * @param <Ret>  The handle returned.
 */
public interface Bit<Onto, Ret> {
    /**
     * Install this on {@code target}.
     *
     * @param target The translator or dispatcher.
     * @return The handle.
     */
    Ret addTo(Onto target);
}
