package com.example.exercise.iface.dto.res;

import java.util.List;

import com.example.exercise.application.domain.exercise.aggregate.vo.MuscleGroup;

public record MuscleGroupsResource(String code, String message, List<MuscleGroup> data) {

}
