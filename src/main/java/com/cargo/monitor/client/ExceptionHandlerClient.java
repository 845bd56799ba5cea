package com.cargo.monitor.client;

import com.cargo.monitor.exception.DispatchTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts findings to the exception-handling agent. The response body is not interpreted;
 * only success or the failure class matters.
 */
@Component
public class ExceptionHandlerClient {

    private static final Logger log = LoggerFactory.getLogger(ExceptionHandlerClient.class);

    static final String MESSAGE_SEND_PATH = "/message:send";

    private final RestClient restClient;

    public ExceptionHandlerClient(@Qualifier("exceptionHandlerRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * @return the HTTP status of an accepted message
     * @throws DispatchTransportException on rejection (4xx, not transient) or transport
     *                                    failure (I/O, timeout, 5xx, transient)
     */
    public int send(HandleExceptionMessage message) {
        try {
            ResponseEntity<Void> response = restClient.post()
                    .uri(MESSAGE_SEND_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(message)
                    .retrieve()
                    .toBodilessEntity();
            log.debug("Exception handler accepted {} with status {}",
                    message.notificationId(), response.getStatusCode().value());
            return response.getStatusCode().value();
        } catch (HttpClientErrorException e) {
            throw DispatchTransportException.rejected(e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (HttpServerErrorException e) {
            throw DispatchTransportException.serverError(e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw DispatchTransportException.io(e);
        } catch (RestClientException e) {
            throw new DispatchTransportException("Unexpected response from exception handler: " + e.getMessage(),
                    false, null, e);
        }
    }
}
