package de.bsommerfeld.vorg.db;

import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Compares an actual list against an expected one, both sorted ascending by
 * the same key, and reports the first difference.
 *
 * <p>
 * Walking both lists position by position:
 * <ul>
 * <li>an actual key greater than the expected key means the expected element
 * is {@link Outcome#MISSING}</li>
 * <li>an actual key smaller than the expected key means the actual element is
 * {@link Outcome#UNEXPECTED}</li>
 * <li>equal keys that fail the equality check are {@link Outcome#UNEQUAL};
 * the reported element is the expected one</li>
 * </ul>
 * Leftovers on either side are reported as missing or unexpected.
 */
public final class ListComparison {

    public enum Outcome {
        IDENTICAL,
        MISSING,
        UNEXPECTED,
        UNEQUAL
    }

    /**
     * @param outcome kind of the first difference found
     * @param element the element the difference is about, {@code null} for
     *                {@link Outcome#IDENTICAL}
     */
    public record Result<T>(Outcome outcome, T element) {

        public boolean isIdentical() {
            return outcome == Outcome.IDENTICAL;
        }
    }

    private ListComparison() {
    }

    /** Compares two sorted lists of naturally ordered, directly comparable elements. */
    public static <T extends Comparable<? super T>> Result<T> compare(List<T> actual, List<T> expected) {
        return compare(actual, expected, Function.identity(), Objects::equals);
    }

    public static <T, K extends Comparable<? super K>> Result<T> compare(
            List<T> actual,
            List<T> expected,
            Function<? super T, ? extends K> key,
            BiPredicate<? super T, ? super T> equality) {

        for (int i = 0; i < actual.size(); i++) {
            T actualElement = actual.get(i);
            if (i >= expected.size())
                return new Result<>(Outcome.UNEXPECTED, actualElement);

            T expectedElement = expected.get(i);
            int order = key.apply(actualElement).compareTo(key.apply(expectedElement));
            if (order > 0)
                return new Result<>(Outcome.MISSING, expectedElement);
            if (order < 0)
                return new Result<>(Outcome.UNEXPECTED, actualElement);
            if (!equality.test(actualElement, expectedElement))
                return new Result<>(Outcome.UNEQUAL, expectedElement);
        }

        if (actual.size() < expected.size())
            return new Result<>(Outcome.MISSING, expected.get(actual.size()));
        return new Result<>(Outcome.IDENTICAL, null);
    }
}
