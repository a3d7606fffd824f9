package com.edge.equipment.controller;

import com.edge.equipment.core.match.MatchStrategy;
import com.edge.equipment.core.model.MatchCandidate;
import com.edge.equipment.core.model.MatchResult;
import com.edge.equipment.core.model.MatchedBy;
import com.edge.equipment.service.CatalogConfigurationException;
import com.edge.equipment.service.CatalogService;
import com.edge.equipment.service.EquipmentMatchingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MatchControllerTest {

    @Mock
    private EquipmentMatchingService matchingService;
    @InjectMocks
    private MatchController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    @DisplayName("Batch response carries one record per probe")
    void batchMatch() throws Exception {
        MatchResult matched = MatchResult.of("probe_1", MatchCandidate.patternOnly("gray_square", 82.0),
            MatchedBy.PATTERN_ONLY, true);
        MatchResult failed = MatchResult.failed("probe_2", "Cannot decode image");
        when(matchingService.matchDirectory(eq(Path.of("probes")), isNull(), eq(MatchStrategy.PATTERN_COLOR), eq(false)))
            .thenReturn(new EquipmentMatchingService.BatchResult(MatchStrategy.PATTERN_COLOR,
                new CatalogService.BuildReport(), List.of(matched, failed), 12));

        mockMvc.perform(post("/api/match")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"probeDirectory\": \"probes\", \"strategy\": \"PATTERN_COLOR\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.probeCount").value(2))
            .andExpect(jsonPath("$.acceptedCount").value(1))
            .andExpect(jsonPath("$.records[0].bestTemplateId").value("gray_square"))
            .andExpect(jsonPath("$.records[0].matchedBy").value("PATTERN_ONLY"))
            .andExpect(jsonPath("$.records[1].error").value("Cannot decode image"));
    }

    @Test
    void blankProbeDirectoryIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/match")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"probeDirectory\": \" \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false));
        verifyNoInteractions(matchingService);
    }

    @Test
    void missingProbeDirectoryIsBadRequest() throws Exception {
        when(matchingService.matchDirectory(any(Path.class), any(), any(), anyBoolean()))
            .thenThrow(new CatalogConfigurationException("Probe directory does not exist: nowhere"));

        mockMvc.perform(post("/api/match")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"probeDirectory\": \"nowhere\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Probe directory does not exist: nowhere"));
    }

    @Test
    void singleMatch() throws Exception {
        MatchResult result = MatchResult.of("icon", MatchCandidate.descriptor("helmet", 74.5),
            MatchedBy.DESCRIPTOR_GEOMETRIC, true);
        when(matchingService.matchSingle(eq(Path.of("probes/icon.png")), eq(Path.of("catalog")),
            eq(MatchStrategy.DESCRIPTOR_GEOMETRIC), eq(false))).thenReturn(result);

        mockMvc.perform(post("/api/match/single")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"probePath\": \"probes/icon.png\", \"catalogDirectory\": \"catalog\", "
                    + "\"strategy\": \"DESCRIPTOR_GEOMETRIC\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.bestTemplateId").value("helmet"))
            .andExpect(jsonPath("$.data.compositeScore").value(74.5))
            .andExpect(jsonPath("$.data.patternScore").doesNotExist());
    }
}
