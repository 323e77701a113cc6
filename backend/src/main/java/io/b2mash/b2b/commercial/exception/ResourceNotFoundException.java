package io.b2mash.b2b.commercial.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A document or customer the store does not know. Results in HTTP 404 with the missing resource
 * named in the {@code resource} and {@code resource_id} problem properties.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  private final String resource;
  private final UUID resourceId;

  private ResourceNotFoundException(String resource, UUID resourceId) {
    super(HttpStatus.NOT_FOUND, createProblem(resource, resourceId), null);
    this.resource = resource;
    this.resourceId = resourceId;
  }

  public static ResourceNotFoundException document(UUID id) {
    return new ResourceNotFoundException("Document", id);
  }

  /** The customer a draft refers to is unknown to the customer directory. */
  public static ResourceNotFoundException customer(UUID id) {
    return new ResourceNotFoundException("Customer", id);
  }

  public String getResource() {
    return resource;
  }

  public UUID getResourceId() {
    return resourceId;
  }

  private static ProblemDetail createProblem(String resource, UUID resourceId) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(resource + " not found");
    problem.setDetail("No " + resource.toLowerCase() + " found with id " + resourceId);
    problem.setProperty("resource", resource.toLowerCase());
    problem.setProperty("resource_id", resourceId);
    return problem;
  }
}
