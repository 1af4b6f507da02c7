/* (C)2026 */
package com.ammann.trialanalysis.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ammann.trialanalysis.dto.QualityReportDTO;
import com.ammann.trialanalysis.dto.ZScoreResultDTO;
import com.ammann.trialanalysis.enumeration.SignificanceLevel;
import com.ammann.trialanalysis.exception.ValidationException;
import com.ammann.trialanalysis.properties.ApiProperties;
import com.ammann.trialanalysis.service.QualityController;
import com.ammann.trialanalysis.service.SessionAnalysisService;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class AnalysisResourceTest {

    private AnalysisResource resource;
    private SessionAnalysisService sessionAnalysis;
    private QualityController qualityController;

    @BeforeEach
    void setUp() {
        sessionAnalysis = mock(SessionAnalysisService.class);
        qualityController = mock(QualityController.class);
        resource = new AnalysisResource();
        resource.sessionAnalysis = sessionAnalysis;
        resource.qualityController = qualityController;
    }

    @Test
    void resource_classHasCorrectPath() {
        Path path = AnalysisResource.class.getAnnotation(Path.class);
        assertThat(path).isNotNull();
        assertThat(path.value()).isEqualTo("/api/v1/analysis");
        assertThat(path.value()).isEqualTo(ApiProperties.BASE_URL_V1 + ApiProperties.Analysis.BASE);
    }

    @Test
    void zScore_returnsServiceReport() {
        ZScoreResultDTO report = new ZScoreResultDTO(
                2.5, 0.0124, 0.0062, 100.1, 100.9, 0.2, 0.25, 100, SignificanceLevel.SIGNIFICANT, Instant.now());
        when(sessionAnalysis.zScore("s-1")).thenReturn(report);

        Response response = resource.zScore("s-1");

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getEntity()).isSameAs(report);
    }

    @Test
    void sessionErrorsPropagate() {
        when(sessionAnalysis.trend(null))
                .thenThrow(ValidationException.invalidParameter("sessionId", null, "a non-blank session id"));

        assertThatThrownBy(() -> resource.trend(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void quality_assessesRequestedHours() {
        QualityReportDTO report = QualityReportDTO.empty(Instant.now());
        when(qualityController.assessRecent(Duration.ofHours(6))).thenReturn(report);

        Response response = resource.quality(6);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getEntity()).isSameAs(report);
        verify(qualityController).assessRecent(Duration.ofHours(6));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 169})
    void quality_rejectsHoursOutOfRange(int hours) {
        assertThatThrownBy(() -> resource.quality(hours))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("hours");
        verifyNoInteractions(qualityController);
    }
}
