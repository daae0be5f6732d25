package com.example.exercise.application.domain.exercise.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import org.junit.jupiter.api.Test;

import com.example.exercise.application.domain.exercise.aggregate.ExerciseStatistics.Entry;
import com.example.exercise.application.domain.exercise.aggregate.vo.MuscleGroup;

class ExerciseCatalogTest {

	@Test
	void supportsSevenMuscleGroups() {
		assertThat(ExerciseCatalog.supportedMuscleGroups()).extracting(MuscleGroup::key).containsExactly("legs",
				"core", "back", "arms", "chest", "shoulders", "cardiovascular");
	}

	@Test
	void exampleEntriesAreZeroCountPlaceholdersForEveryPair() {
		int pairs = ExerciseCatalog.supportedMuscleGroups().stream().mapToInt(mg -> mg.exercises().size()).sum();

		assertThat(ExerciseCatalog.allExampleEntries()).hasSize(pairs).allSatisfy(entry -> {
			assertThat(entry.count()).isZero();
			assertThat(entry.intendedIntensity()).isZero();
			assertThat(entry.exercise().intensity()).isNull();
		});
		assertThat(ExerciseCatalog.allExampleEntries()).extracting(Entry::key, e -> e.exercise().name())
				.contains(tuple("back", "deadlift"));
	}

	@Test
	void findsMuscleGroupByKey() {
		assertThat(ExerciseCatalog.findMuscleGroup("shoulders")).map(MuscleGroup::title).hasValue("Shoulders");
		assertThat(ExerciseCatalog.findMuscleGroup("neck")).isEmpty();
	}
}
