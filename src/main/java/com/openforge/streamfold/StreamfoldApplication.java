package com.openforge.streamfold;

import com.openforge.streamfold.config.ResilienceProperties;
import com.openforge.streamfold.document.LoaderProperties;
import com.openforge.streamfold.llm.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

// Register ConfigurationProperties globally so the startup summary can read
// them even when the conditional LLM and loader beans are not loaded.
@SpringBootApplication
@EnableConfigurationProperties({LlmProperties.class, LoaderProperties.class, ResilienceProperties.class})
public class StreamfoldApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamfoldApplication.class, args);
    }
}
