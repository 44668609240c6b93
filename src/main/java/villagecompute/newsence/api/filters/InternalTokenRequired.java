package villagecompute.newsence.api.filters;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import jakarta.ws.rs.NameBinding;

/**
 * JAX-RS name binding for endpoints that require the shared internal token.
 *
 * <p>
 * The token is read from {@code X-Internal-Token} or {@code Authorization: Bearer}. When
 * {@code newsence.internal-token} is unset the endpoints stay open.
 *
 * @see InternalTokenFilter for enforcement
 */
@NameBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface InternalTokenRequired {
}
