package com.phillippitts.speakerverify.service.extractor.process;

import com.phillippitts.speakerverify.config.properties.ExtractorConfig;
import com.phillippitts.speakerverify.service.extractor.EmbeddingExtractor;
import com.phillippitts.speakerverify.service.extractor.ModelLoader;
import com.phillippitts.speakerverify.service.extractor.ModelSpec;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Loads a model by starting a dedicated embedding worker process for it.
 */
@Component
public class ProcessModelLoader implements ModelLoader {

    private final ProcessFactory processFactory;
    private final ExtractorConfig config;

    @Autowired
    public ProcessModelLoader(ExtractorConfig config) {
        this(new DefaultProcessFactory(), config);
    }

    ProcessModelLoader(ProcessFactory processFactory, ExtractorConfig config) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public EmbeddingExtractor load(ModelSpec spec) {
        ProcessEmbeddingExtractor extractor = new ProcessEmbeddingExtractor(processFactory, config, spec);
        extractor.start();
        return extractor;
    }
}
