package com.sommerph.zkpipeline.model.artifact;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubjectInput {

    @NotBlank
    private String subjectId;
    @NotEmpty
    private List<Double> inputVector;
    @NotNull
    private Double plaintextScore;

}
