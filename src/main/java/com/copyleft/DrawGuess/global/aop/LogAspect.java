package com.copyleft.DrawGuess.global.aop;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;

import java.util.Arrays;

@Slf4j
@Aspect
@Component
public class LogAspect {

    @Pointcut("execution(public * com.copyleft.DrawGuess.feature..*Service.*(..))")
    public void serviceLayer() {}

    @Around("serviceLayer()")
    public Object logExecutionTime(ProceedingJoinPoint joinPoint) throws Throwable {
        StopWatch stopWatch = new StopWatch();
        stopWatch.start();

        String className = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = joinPoint.getSignature().getName();
        Object[] args = joinPoint.getArgs();

        log.debug("▶ [START] {}.{} | Args: {}", className, methodName, Arrays.deepToString(args));

        try {
            return joinPoint.proceed();
        } catch (Throwable e) {
            log.error("🛑 [EXCEPTION] {}.{} | Msg: {}", className, methodName, e.getMessage(), e);
            throw e;
        } finally {
            if (stopWatch.isRunning()) {
                stopWatch.stop();
            }
            log.debug("◀ [END] {}.{} | Time: {}ms", className, methodName, stopWatch.getTotalTimeMillis());
        }
    }
}
