/*
 * Where: Deadline infrastructure configuration
 * What: RestClient dedicated to the push provider
 * Why: Connect and read timeouts bound every push attempt at the socket level
 */
package com.example.deadline.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class PushChannelConfig {

  @Bean
  RestClient pushRestClient(RestClient.Builder builder, PushChannelProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.requestFactory(requestFactory).build();
  }
}
