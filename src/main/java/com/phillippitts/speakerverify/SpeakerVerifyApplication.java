package com.phillippitts.speakerverify;

import com.phillippitts.speakerverify.config.properties.AudioSourceProperties;
import com.phillippitts.speakerverify.config.properties.AudioValidationProperties;
import com.phillippitts.speakerverify.config.properties.CacheProperties;
import com.phillippitts.speakerverify.config.properties.DownloadProperties;
import com.phillippitts.speakerverify.config.properties.ExtractorConfig;
import com.phillippitts.speakerverify.config.properties.ModelProperties;
import com.phillippitts.speakerverify.config.properties.StatsProperties;
import com.phillippitts.speakerverify.config.properties.ThreadPoolProperties;
import com.phillippitts.speakerverify.config.properties.VerificationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
@EnableConfigurationProperties({
        VerificationProperties.class,
        ModelProperties.class,
        ExtractorConfig.class,
        AudioSourceProperties.class,
        CacheProperties.class,
        DownloadProperties.class,
        AudioValidationProperties.class,
        StatsProperties.class,
        ThreadPoolProperties.class
})
public class SpeakerVerifyApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeakerVerifyApplication.class, args);
    }
}
