package com.example.reelroom.config;

import com.example.reelroom.capture.NavigationInterceptor;
import com.example.reelroom.capture.NetworkInterceptor;
import com.example.reelroom.capture.OutboundHttpClients;
import com.example.reelroom.capture.TraceEntryBuilder;
import com.example.reelroom.capture.UrlIgnorePredicate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Configuration
public class CaptureConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Outbound HTTP used by application code. Everything sent through it is recorded while the
     * recorder runs.
     */
    @Bean
    public OutboundHttpClients outboundHttpClients() {
        return new OutboundHttpClients(new SimpleClientHttpRequestFactory());
    }

    @Bean
    public TraceEntryBuilder traceEntryBuilder(ReelroomProperties props, Clock clock) {
        return new TraceEntryBuilder(props.getCapture().getMaxBodyChars(), clock);
    }

    @Bean
    public NetworkInterceptor networkInterceptor(OutboundHttpClients clients, TraceEntryBuilder builder, ReelroomProperties props) {
        // never record our own uploads
        List<String> ignore = new ArrayList<>(props.getCapture().getIgnoreUrlPatterns());
        ignore.add(props.getUpload().getEndpoint());
        return new NetworkInterceptor(clients, builder, new UrlIgnorePredicate(ignore));
    }

    @Bean
    public NavigationInterceptor navigationInterceptor(Clock clock) {
        return new NavigationInterceptor(clock);
    }
}
