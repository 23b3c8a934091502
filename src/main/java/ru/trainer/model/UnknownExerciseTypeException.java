package ru.trainer.model;

/**
 * Thrown when a name, alias or numeric code does not match any {@link ExerciseType}.
 */
public class UnknownExerciseTypeException extends IllegalArgumentException {

    public UnknownExerciseTypeException(String value) {
        super("Unknown exercise type '%s'".formatted(value));
    }

    public UnknownExerciseTypeException(long code) {
        super("Unknown exercise type code %d".formatted(code));
    }
}
