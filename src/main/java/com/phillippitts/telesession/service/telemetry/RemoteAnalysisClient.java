package com.phillippitts.telesession.service.telemetry;

import com.phillippitts.telesession.domain.PoseFrame;
import com.phillippitts.telesession.exception.AnalysisFailureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Objects;

/**
 * Calls an HTTP analysis endpoint: POSTs the frame as JSON and reads
 * {@code {"score": .., "feedback": ..}} back.
 */
public class RemoteAnalysisClient implements AnalysisClient {

    private static final Logger LOG = LogManager.getLogger(RemoteAnalysisClient.class);

    private final RestTemplate restTemplate;
    private final String url;
    private final TelemetryMessageCodec codec;

    public RemoteAnalysisClient(RestTemplate restTemplate, String url, TelemetryMessageCodec codec) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.url = Objects.requireNonNull(url, "url must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public Analysis analyze(PoseFrame frame) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        HttpEntity<String> request = new HttpEntity<>(codec.encodeFrame(frame), headers);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, request, String.class);
        } catch (RestClientException e) {
            throw new AnalysisFailureException("Analysis call failed for frame " + frame.sequenceNumber(), e);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new AnalysisFailureException("Analysis endpoint returned " + response.getStatusCode().value());
        }
        Analysis analysis = codec.decodeAnalysis(response.getBody());
        LOG.trace("Frame {} scored {}", frame.sequenceNumber(), analysis.score());
        return analysis;
    }
}
