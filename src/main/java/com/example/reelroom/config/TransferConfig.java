package com.example.reelroom.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

@Configuration
public class TransferConfig {

    /**
     * Template for uploads and archive downloads. It is not part of {@code OutboundHttpClients},
     * so transfers are never recorded, and it streams request bodies instead of buffering them.
     */
    @Bean
    public RestTemplate transferRestTemplate(ReelroomProperties props) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setBufferRequestBody(false);
        int timeout = (int) Math.min(Integer.MAX_VALUE, props.getUpload().getTimeoutMs());
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return new RestTemplate(factory);
    }

    @Bean(name = "recorderScheduler")
    public ThreadPoolTaskScheduler recorderScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("recorder-");
        scheduler.setDaemon(true);
        return scheduler;
    }
}
