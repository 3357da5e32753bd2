package com.patentflow.orchestrator.stage;

/**
 * Declares that a result key carries a binary file to be stored as an artifact.
 *
 * @param fileRole    role within the stage, e.g. "reply" or "revised"; part of the file name
 * @param extension   file extension without the dot
 * @param contentType MIME type stored with the artifact
 */
public record ArtifactOutput(String fileRole, String extension, String contentType) {

    public static final String DOCX_TYPE =
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    public static ArtifactOutput docx(String fileRole) {
        return new ArtifactOutput(fileRole, "docx", DOCX_TYPE);
    }

    /** "<step_id>_<role>.<ext>" */
    public String fileNameFor(String stepId) {
        return stepId + "_" + fileRole + "." + extension;
    }
}
