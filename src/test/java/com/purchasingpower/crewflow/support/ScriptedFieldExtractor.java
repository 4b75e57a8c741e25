package com.purchasingpower.crewflow.support;

import com.purchasingpower.crewflow.fields.ExtractionRequest;
import com.purchasingpower.crewflow.fields.ExtractionResult;
import com.purchasingpower.crewflow.fields.FieldExtractor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Field extractor returning scripted values and recording every request.
 */
public class ScriptedFieldExtractor implements FieldExtractor {

    private final List<ExtractionRequest> requests = Collections.synchronizedList(new ArrayList<>());
    private volatile Function<ExtractionRequest, ExtractionResult> script = request -> ExtractionResult.empty(List.of());

    public ScriptedFieldExtractor respondWith(Function<ExtractionRequest, ExtractionResult> script) {
        this.script = script;
        return this;
    }

    /**
     * Always extract the given values.
     */
    public ScriptedFieldExtractor extracting(Map<String, Object> values) {
        return respondWith(request -> ExtractionResult.builder().extractedFields(values).build());
    }

    public List<ExtractionRequest> getRequests() {
        return List.copyOf(requests);
    }

    @Override
    public ExtractionResult extract(ExtractionRequest request) {
        requests.add(request);
        return script.apply(request);
    }
}
