package com.patentflow.orchestrator.stage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.patentflow.orchestrator.codec.PayloadCodec;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class PatentStagesTest {

    PayloadCodec codec = new PayloadCodec(new ObjectMapper());

    @Test
    void allStages_registerWithDefaults() {
        StageRegistry registry = registry(new MockEnvironment());

        assertThat(registry.all()).extracting(StageDefinition::key).containsExactlyInAnyOrder(
                "title2scene", "info2tech", "scene2tech", "tech2application",
                "align2tex2docx", "md2docx", "review2revise");
        assertThat(registry.get("tech2application").timeout()).isEqualTo(Duration.ofMinutes(40));
        assertThat(registry.get("align2tex2docx").stepIdPrefix()).isEqualTo("A2D");
        assertThat(registry.get("review2revise").heartbeatInterval()).isEqualTo(Duration.ofSeconds(100));
    }

    @Test
    void overrides_boundFromEnvironment() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("patentflow.stages.md2docx.timeout", "5m")
                .withProperty("patentflow.stages.md2docx.heartbeat-interval", "30s")
                .withProperty("patentflow.stages.md2docx.endpoint", "docx/render");

        StageDefinition md2docx = new PatentStages(env).md2docx();

        assertThat(md2docx.timeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(md2docx.heartbeatInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(md2docx.endpointName()).isEqualTo("docx/render");
    }

    @Test
    void scene2tech_writesFinalTechToBothFields() {
        StageDefinition stage = new PatentStages(new MockEnvironment()).scene2tech();

        assertThat(stage.fieldMapping()).containsEntry("final_tech", "final_tech").containsEntry("tech", "final_tech");
        assertThat(stage.fieldMapping()).hasSize(17);
        assertThat(stage.requiredFields()).containsExactly("patent_title", "scene");
    }

    @Test
    void scene2tech_payloadCarriesSceneAndIntermediateFiles() {
        StageDefinition stage = new PatentStages(new MockEnvironment()).scene2tech();
        Map<String, String> fields = new HashMap<>();
        fields.put("patent_title", "Widget");
        fields.put("scene", "a kitchen");
        fields.put("design_00", "first design");

        Map<String, Object> input = stage.payloadBuilder().build(inputs("PAT-1-S2T-2", fields), codec);

        assertThat(input).containsOnlyKeys("patent_title", "base64file", "mid_files");
        assertThat(codec.decompressText((String) input.get("base64file"))).isEqualTo("a kitchen");
        assertThat((List<?>) codec.decompressJson((String) input.get("mid_files")))
                .singleElement()
                .satisfies(f -> assertThat(((Map<?, ?>) f).get("original_filename")).isEqualTo("4_1.2_design_0.txt"));
    }

    @Test
    void md2docx_isPatentFlagSentAsNumber() {
        StageDefinition stage = new PatentStages(new MockEnvironment()).md2docx();

        Map<String, Object> yes = stage.payloadBuilder().build(
                inputs("PAT-1-M2D-1", Map.of("md", "# T", "is_patent", "true")), codec);
        Map<String, Object> no = stage.payloadBuilder().build(
                inputs("PAT-1-M2D-2", Map.of("md", "# T")), codec);

        assertThat(yes).containsEntry("is_patent", 1).containsEntry("md_base64", "IyBU");
        assertThat(no).containsEntry("is_patent", 0);
    }

    @Test
    void review2revise_mapsTextsAndTwoDocuments() {
        StageDefinition stage = new PatentStages(new MockEnvironment()).review2revise();

        assertThat(stage.fieldMapping()).containsExactly(
                Map.entry("reply_review", "reply_review_txt"),
                Map.entry("revised_application", "revised_application_txt"));
        assertThat(stage.artifactOutputs()).containsOnlyKeys("reply_review_docx_bytes", "revised_application_docx_bytes");

        Map<String, Object> input = stage.payloadBuilder().build(inputs("PAT-1-R2R-1",
                Map.of("review_pdf_base64", "  JVBERi0=\n", "current_application", "claims")), codec);
        assertThat(input).containsEntry("review_base64", "JVBERi0=");
    }

    private static StageRegistry registry(MockEnvironment env) {
        PatentStages config = new PatentStages(env);
        return new StageRegistry(List.of(config.title2scene(), config.info2tech(), config.scene2tech(),
                config.tech2application(), config.align2tex2docx(), config.md2docx(), config.review2revise()),
                Duration.ofMinutes(70));
    }

    private static StageInputs inputs(String stepId, Map<String, String> fields) {
        return new StageInputs(UUID.randomUUID(), "PAT-1", stepId, "/tmp/" + stepId, fields);
    }
}
