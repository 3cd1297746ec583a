package com.codeheadsystems.vionex.server.resource;

import com.codeheadsystems.vionex.model.auth.ErrorResponse;
import com.codeheadsystems.vionex.server.error.StoreUnavailableException;
import com.codeheadsystems.vionex.server.ratelimit.RateLimiter;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Throttles {@link RateLimited} endpoints through a {@link RateLimiter}.
 * <p>
 * The key is {@code <client address>:<request path>}. The client address is read from
 * {@code X-Forwarded-For}, counting {@code trustedProxies} entries in from the right: each proxy
 * appends the peer it saw, so entries left of that position are whatever the client sent. With no
 * usable entry, or with zero trusted proxies, the address is {@code unknown}.
 * <ul>
 *   <li>Denied: aborts with 429 and a {@code Retry-After} of the window length.</li>
 *   <li>Store unavailable: aborts with 503. The request is never let through unchecked.</li>
 * </ul>
 */
@RateLimited
@Priority(Priorities.AUTHENTICATION - 100)
public class RateLimitFilter implements ContainerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

  static final String FORWARDED_FOR = "X-Forwarded-For";
  static final String UNKNOWN_CLIENT = "unknown";
  public static final int DEFAULT_TRUSTED_PROXIES = 1;

  private final RateLimiter rateLimiter;
  private final int trustedProxies;

  public RateLimitFilter(RateLimiter rateLimiter) {
    this(rateLimiter, DEFAULT_TRUSTED_PROXIES);
  }

  /**
   * @param rateLimiter    the limiter to consult
   * @param trustedProxies number of proxies in front of this service that append to
   *                       {@code X-Forwarded-For}
   */
  public RateLimitFilter(RateLimiter rateLimiter, int trustedProxies) {
    if (trustedProxies < 0) {
      throw new IllegalArgumentException("trustedProxies must not be negative: " + trustedProxies);
    }
    this.rateLimiter = rateLimiter;
    this.trustedProxies = trustedProxies;
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    String key = clientAddress(requestContext, trustedProxies) + ":/" + stripLeadingSlash(requestContext.getUriInfo().getPath());
    boolean admitted;
    try {
      admitted = rateLimiter.checkAndRecord(key);
    } catch (StoreUnavailableException e) {
      log.error("Rate limit store unavailable, rejecting request: {}", e.getMessage());
      requestContext.abortWith(Response.status(Response.Status.SERVICE_UNAVAILABLE)
          .type(MediaType.APPLICATION_JSON_TYPE)
          .entity(ErrorResponse.of("Service temporarily unavailable"))
          .build());
      return;
    }
    if (!admitted) {
      log.info("Rate limit exceeded for {}", key);
      requestContext.abortWith(Response.status(429)
          .type(MediaType.APPLICATION_JSON_TYPE)
          .header("Retry-After", rateLimiter.config().window().getSeconds())
          .entity(ErrorResponse.of("Too many requests. Please try again later"))
          .build());
    }
  }

  static String clientAddress(ContainerRequestContext requestContext, int trustedProxies) {
    String forwarded = requestContext.getHeaderString(FORWARDED_FOR);
    if (trustedProxies == 0 || forwarded == null || forwarded.isBlank()) {
      return UNKNOWN_CLIENT;
    }
    String[] entries = forwarded.split(",");
    // Fewer entries than proxies: the leftmost one was still written by a trusted hop.
    String entry = entries[Math.max(0, entries.length - trustedProxies)].trim();
    return entry.isEmpty() ? UNKNOWN_CLIENT : entry;
  }

  private static String stripLeadingSlash(String path) {
    return path.startsWith("/") ? path.substring(1) : path;
  }
}
