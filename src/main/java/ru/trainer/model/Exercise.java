package ru.trainer.model;

import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

import java.util.Optional;

/**
 * Id 0 means unassigned, so a real id 0 also reads back as absent.
 */
@Value
@ToString(doNotUseGetters = true)
public class Exercise {

    private static final int UNASSIGNED_ID = 0;

    Integer id;
    String name;
    ExerciseType exerciseType;
    String description;

    private Exercise(int id, @NonNull String name, @NonNull ExerciseType exerciseType, String description) {
        this.id = id == UNASSIGNED_ID ? null : id;
        this.name = name;
        this.exerciseType = exerciseType;
        this.description = description == null ? "" : description;
    }

    public static Exercise create(String name, ExerciseType exerciseType) {
        return create(name, exerciseType, "");
    }

    public static Exercise create(String name, ExerciseType exerciseType, String description) {
        return create(UNASSIGNED_ID, name, exerciseType, description);
    }

    public static Exercise create(int id, String name, ExerciseType exerciseType, String description) {
        return new Exercise(id, name, exerciseType, description);
    }

    /**
     * @return the identifier, or empty when none was assigned
     */
    public Optional<Integer> getId() {
        return Optional.ofNullable(id);
    }

    public boolean hasId() {
        return id != null;
    }
}
