package com.architecture.memory.diagramsynth.controller;

import com.architecture.memory.diagramsynth.dto.diagram.BoardConnector;
import com.architecture.memory.diagramsynth.dto.diagram.BoardOutput;
import com.architecture.memory.diagramsynth.dto.diagram.BoardShape;
import com.architecture.memory.diagramsynth.dto.diagram.DiagramError;
import com.architecture.memory.diagramsynth.exception.GlobalExceptionHandler;
import com.architecture.memory.diagramsynth.model.diagram.DiagramType;
import com.architecture.memory.diagramsynth.model.layout.LayoutConfig;
import com.architecture.memory.diagramsynth.service.diagram.DiagramSynthesisService;
import com.architecture.memory.diagramsynth.service.diagram.SynthesisResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DiagramControllerTest {

    @Mock
    private DiagramSynthesisService synthesisService;

    @InjectMocks
    private DiagramController diagramController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(diagramController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void render_returnsPrimitivesAndSummary() throws Exception {
        LayoutConfig config = LayoutConfig.defaults().toBuilder().startX(100).build();
        BoardOutput output = BoardOutput.builder().build();
        output.addShape(BoardShape.builder().kind("rectangle").text("A").width(180).height(70).build());
        output.addShape(BoardShape.builder().kind("rectangle").text("B").width(180).height(70).build());
        output.getConnectors().add(BoardConnector.builder().startIndex(0).endIndex(1).lineStyle("normal").build());

        when(synthesisService.layoutFor(100.0, null, null)).thenReturn(config);
        when(synthesisService.synthesize(anyString(), eq(config), eq(true)))
                .thenReturn(SynthesisResult.success(output, DiagramType.FLOWCHART, 180, 260, 2, List.of()));

        mockMvc.perform(post("/api/diagrams/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"diagram\":\"flowchart TB\\nA --> B\",\"startX\":100,\"useStencils\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.diagramType").value("flowchart"))
                .andExpect(jsonPath("$.nodesCount").value(2))
                .andExpect(jsonPath("$.connectorsCount").value(1))
                .andExpect(jsonPath("$.framesCount").value(0))
                .andExpect(jsonPath("$.shapes.length()").value(2))
                .andExpect(jsonPath("$.connectors[0].endIndex").value(1))
                .andExpect(jsonPath("$.diagramHeight").value(260.0))
                .andExpect(jsonPath("$.message").value("Created diagram with 2 nodes, 1 connectors"));

        verify(synthesisService).synthesize("flowchart TB\nA --> B", config, true);
    }

    @Test
    void render_failedPipeline_isBadRequestWithError() throws Exception {
        when(synthesisService.layoutFor(any(), any(), any())).thenReturn(LayoutConfig.defaults());
        when(synthesisService.synthesize(anyString(), any(), anyBoolean()))
                .thenReturn(SynthesisResult.failure(DiagramError.noNodes()));

        mockMvc.perform(post("/api/diagrams/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"diagram\":\"flowchart TB\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("NO_NODES"))
                .andExpect(jsonPath("$.message").value("no nodes found in diagram"));
    }

    @Test
    void render_blankDiagram_isRejectedBeforeService() throws Exception {
        mockMvc.perform(post("/api/diagrams/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"diagram\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.diagram").value("Diagram text is required"));

        verifyNoInteractions(synthesisService);
    }

    @Test
    void render_malformedBody_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/diagrams/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    void validate_reportsValidDiagram() throws Exception {
        when(synthesisService.validate("flowchart TB\nA")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/diagrams/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"diagram\":\"flowchart TB\\nA\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.error").value(nullValue()));
    }

    @Test
    void validate_reportsErrorWithOkStatus() throws Exception {
        when(synthesisService.validate("A -> B"))
                .thenReturn(Optional.of(DiagramError.missingHeader().withLine(1).withInput("A -> B")));

        mockMvc.perform(post("/api/diagrams/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"diagram\":\"A -> B\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.error.code").value("MISSING_HEADER"))
                .andExpect(jsonPath("$.error.line").value(1));
    }
}
