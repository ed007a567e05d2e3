package com.diseaseforecast.service;

import com.diseaseforecast.entity.ModelArtifact;
import com.diseaseforecast.exception.PersistenceFailureException;
import com.diseaseforecast.timeseries.SarimaState;
import com.diseaseforecast.timeseries.SeasonalArimaModel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Converts a fitted model to the JSON payload stored with its artifact, and back.
 */
@Component
@RequiredArgsConstructor
public class ModelPayloadCodec {

    private final ObjectMapper mapper;

    public String encode(SeasonalArimaModel model) {
        try {
            return mapper.writeValueAsString(model.toState());
        } catch (JsonProcessingException ex) {
            throw new PersistenceFailureException("Could not serialize model state", ex);
        }
    }

    public SeasonalArimaModel decode(ModelArtifact artifact) {
        try {
            return SeasonalArimaModel.fromState(mapper.readValue(artifact.getPayload(), SarimaState.class));
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new PersistenceFailureException(
                "Stored model '" + artifact.getVersion() + "' cannot be read back", ex);
        }
    }
}
