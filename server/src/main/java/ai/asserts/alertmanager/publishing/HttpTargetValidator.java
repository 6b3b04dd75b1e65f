/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.publishing;

import ai.asserts.alertmanager.config.TargetConfig;
import ai.asserts.alertmanager.error.ValidationException;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * A target is valid when its configuration is well formed and its endpoint answers an HTTP HEAD request. Any
 * HTTP status counts as reachable; only transport failures invalidate the target.
 */
@Slf4j
@Component
@AllArgsConstructor
public class HttpTargetValidator implements TargetValidator {
    private final RestTemplate restTemplate;
    private final Clock clock;

    @Override
    public PublishingTarget validate(TargetConfig candidate) {
        PublishingTarget.PublishingTargetBuilder target = PublishingTarget.builder()
                .name(candidate.getName())
                .url(candidate.getUrl())
                .type(candidate.getType())
                .headers(candidate.getHeaders());
        try {
            candidate.validate(0);
            HttpHeaders headers = new HttpHeaders();
            if (candidate.getHeaders() != null) {
                candidate.getHeaders().forEach(headers::set);
            }
            restTemplate.exchange(candidate.getUrl(), HttpMethod.HEAD, new HttpEntity<>(headers), Void.class);
            target.valid(true);
        } catch (RestClientResponseException e) {
            log.debug("Target {} answered {}", candidate.getName(), e.getRawStatusCode());
            target.valid(true);
        } catch (ValidationException | RestClientException e) {
            log.warn("Target {} failed validation: {}", candidate.getName(), e.getMessage());
            target.valid(false).error(e.getMessage());
        }
        return target.lastValidatedAt(clock.instant()).build();
    }
}
