package io.b2mash.credentialjobs.config;

import java.net.http.HttpClient;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;

@Configuration
public class RestClientConfig {

  /** Applies the job's timeouts to every {@code RestClient} built from the shared builder. */
  @Bean
  public RestClientCustomizer timeoutCustomizer(JobProperties jobProperties) {
    var http = jobProperties.http();
    return builder -> {
      var httpClient = HttpClient.newBuilder().connectTimeout(http.connectTimeout()).build();
      var requestFactory = new JdkClientHttpRequestFactory(httpClient);
      requestFactory.setReadTimeout(http.readTimeout());
      builder.requestFactory(requestFactory);
    };
  }
}
