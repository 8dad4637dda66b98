package io.github.reugn.route4j.processor;

/**
 * One call argument of an annotation, in written order.
 *
 * @param label the element name, or {@code null} for an unlabeled argument
 * @param value the argument value
 * @param <V>   the value type
 */
record Argument<V>(String label, V value) {

    static <V> Argument<V> labeled(String label, V value) {
        return new Argument<>(label, value);
    }

    static <V> Argument<V> unlabeled(V value) {
        return new Argument<>(null, value);
    }
}
