package ru.trainer.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.trainer.config.CatalogConfig;
import ru.trainer.model.Exercise;
import ru.trainer.model.ExerciseType;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Exercises predefined in {@code application.properties}, built once when the
 * context starts. An entry with an unknown type stops the application.
 */
@Slf4j
@Component
public class ExerciseCatalog {

    private final List<Exercise> exercises;

    public ExerciseCatalog(CatalogConfig config) {
        List<CatalogConfig.Entry> entries = config.getExercises();
        this.exercises = IntStream.range(0, entries.size())
                .mapToObj(index -> toExercise(index, entries.get(index)))
                .collect(Collectors.toUnmodifiableList());
        log.info("Loaded {} predefined exercises", exercises.size());
        exercises.forEach(exercise -> log.debug("Predefined exercise: {}", exercise));
    }

    public List<Exercise> getExercises() {
        return exercises;
    }

    public int size() {
        return exercises.size();
    }

    private static Exercise toExercise(int index, CatalogConfig.Entry entry) {
        if (entry.getName() == null) {
            throw new IllegalStateException("trainer.catalog.exercises[%d].name is missing".formatted(index));
        }
        ExerciseType type = ExerciseType.fromString(entry.getType());
        String description = entry.getDescription();

        if (entry.getId() != 0) {
            return Exercise.create(entry.getId(), entry.getName(), type, description);
        }
        if (description == null || description.isEmpty()) {
            return Exercise.create(entry.getName(), type);
        }
        return Exercise.create(entry.getName(), type, description);
    }
}
