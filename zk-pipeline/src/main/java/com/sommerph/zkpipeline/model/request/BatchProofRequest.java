package com.sommerph.zkpipeline.model.request;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchProofRequest {

    @NotEmpty
    private List<String> subjectIds;
    private boolean generateContract;

}
