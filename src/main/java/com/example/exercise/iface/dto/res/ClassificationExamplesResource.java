package com.example.exercise.iface.dto.res;

import java.util.List;

import com.example.exercise.application.domain.exercise.aggregate.vo.Exercise;

public record ClassificationExamplesResource(String code, String message, List<Exercise> data) {

}
