package ru.trainer.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * Equipment category of an exercise.
 *
 * <p>Each type has a stable numeric code for storage and a short alias
 * accepted wherever users type the category by hand.</p>
 */
@Getter
@RequiredArgsConstructor
public enum ExerciseType {
    BARBELL(0, "bb"),
    KETTLEBELL(1, "kb");

    private final long code;
    private final String alias;

    public static ExerciseType fromCode(long code) {
        for (ExerciseType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new UnknownExerciseTypeException(code);
    }

    /**
     * Parses either the full name or the alias, ignoring case and surrounding whitespace.
     *
     * @throws UnknownExerciseTypeException for {@code null}, blank or unrecognised input
     */
    public static ExerciseType fromString(String value) {
        if (value == null) {
            throw new UnknownExerciseTypeException("null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExerciseType type : values()) {
            if (type.alias.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new UnknownExerciseTypeException(value);
    }
}
