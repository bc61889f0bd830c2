package com.sommerph.zkpipeline.prover;

import java.nio.file.Path;
import java.util.List;

/**
 * One blocking call per proving engine command. Implementations only check the exit status
 * and that the promised output files exist; artifact contents are never interpreted.
 *
 * <p>Every method throws {@link com.sommerph.zkpipeline.exception.ExternalToolException} when
 * the engine fails and {@link com.sommerph.zkpipeline.exception.InconsistentToolOutputException}
 * when it reports success without writing its outputs.
 */
public interface ExternalProverClient {

    Path generateSettings(Path model, Path settings);

    Path calibrateSettings(Path model, Path calibrationInput, Path settings);

    Path compileCircuit(Path model, Path settings, Path compiledCircuit);

    /**
     * Fetches the reference string unless a file already exists at the target path.
     */
    Path downloadReferenceString(Path settings, Path referenceString);

    List<Path> runSetup(Path compiledCircuit, Path referenceString, Path provingKey, Path verificationKey);

    Path generateWitness(Path input, Path compiledCircuit, Path witness);

    Path prove(Path witness, Path provingKey, Path compiledCircuit, Path referenceString, Path proof);

    /**
     * A proof that does not verify is a result, not an exception.
     */
    VerifyResult verify(Path proof, Path verificationKey, Path referenceString, Path settings);

    Path createEvmVerifier(Path settings, Path verificationKey, Path referenceString, Path contract);

    Path encodeCalldata(Path proof, Path calldata);

}
