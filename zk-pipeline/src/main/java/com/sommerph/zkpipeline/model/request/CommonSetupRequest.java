package com.sommerph.zkpipeline.model.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommonSetupRequest {

    @NotBlank
    private String modelPath;
    @NotBlank
    private String referenceStringPath;
    // sample input for calibrate-settings, optional
    private String calibrationInputPath;

}
