package com.patentflow.orchestrator.stage;

import com.patentflow.orchestrator.codec.PayloadCodec;

import java.util.Map;

/**
 * Builds the stage-specific part of the remote "input" object.
 *
 * The engine adds "tmp_folder" itself; builders only contribute stage fields.
 */
@FunctionalInterface
public interface PayloadBuilder {

    Map<String, Object> build(StageInputs inputs, PayloadCodec codec);
}
