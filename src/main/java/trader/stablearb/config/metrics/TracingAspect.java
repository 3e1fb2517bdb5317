package trader.stablearb.config.metrics;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import lombok.RequiredArgsConstructor;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

/**
 * Wraps every public call into the external clients in an observation.
 */
@Aspect
@Component
@RequiredArgsConstructor
public class TracingAspect {

    private final ObservationRegistry observationRegistry;

    @Pointcut("execution(public * trader.stablearb.client.*Client.*(..))")
    public void apiClientMethods() {}

    @Around("apiClientMethods()")
    public Object traceApiCalls(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        String methodName = method.getName();
        String className = method.getDeclaringClass().getSimpleName();

        return Observation.createNotStarted("api.client." + className + "." + methodName, observationRegistry)
                .lowCardinalityKeyValue("className", className)
                .lowCardinalityKeyValue("methodName", methodName)
                .observe(() -> {
                    try {
                        return joinPoint.proceed();
                    } catch (RuntimeException e) {
                        throw e;
                    } catch (Throwable t) {
                        throw new IllegalStateException(t);
                    }
                });
    }
}
