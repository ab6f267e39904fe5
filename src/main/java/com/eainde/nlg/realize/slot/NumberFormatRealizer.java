package com.eainde.nlg.realize.slot;

import com.eainde.nlg.model.Slot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Formats numeric slot text: integral values lose the decimal part, others keep two significant
 * decimals past the first non-zero rounding, rounding half to even on the exact binary value.
 * Values that round to zero at every precision are left as they are. The {@code abs} flag drops the
 * sign.
 *
 * <p>Formatting an already formatted number yields the same text, which is what lets the slot
 * realization loop terminate.</p>
 */
public class NumberFormatRealizer implements SlotRealizerComponent {

    public static final String ABS = "abs";

    private static final int MAX_PRECISION = 5;

    @Override
    public List<String> supportedLanguages() {
        return List.of(ANY_LANGUAGE);
    }

    @Override
    public Optional<List<Slot>> realize(Slot slot, Random random) {
        String text = slot.value();
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException notANumber) {
            return Optional.empty();
        }
        if (!Double.isFinite(value)) {
            return Optional.empty();
        }
        if (slot.hasFlag(ABS)) {
            value = Math.abs(value);
        }
        Optional<String> formatted = format(value).filter(number -> !number.equals(text));
        if (formatted.isEmpty()) {
            return Optional.empty();
        }
        Slot formattedSlot = slot.copy(true);
        formattedSlot.resolve(formatted.get());
        return Optional.of(List.of(formattedSlot));
    }

    /** Empty when every precision up to {@code MAX_PRECISION} rounds the value to zero. */
    static Optional<String> format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < Long.MAX_VALUE) {
            return Optional.of(Long.toString((long) value));
        }
        BigDecimal exact = new BigDecimal(value);
        for (int precision = 0; precision < MAX_PRECISION; precision++) {
            if (exact.setScale(precision, RoundingMode.HALF_EVEN).signum() != 0) {
                BigDecimal rounded = exact.setScale(precision + 2, RoundingMode.HALF_EVEN).stripTrailingZeros();
                return Optional.of(rounded.toPlainString());
            }
        }
        return Optional.empty();
    }
}
