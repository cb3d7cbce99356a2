package me.golemcore.chatreport.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.chatreport.domain.exception.AnalysisAuthenticationException;
import me.golemcore.chatreport.domain.exception.AnalysisException;
import me.golemcore.chatreport.domain.exception.AnalysisRateLimitedException;
import me.golemcore.chatreport.domain.exception.AnalysisTransientException;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates langchain4j and transport failures into analysis exceptions.
 *
 * <p>
 * langchain4j exceptions are matched by class name so the classifier keeps
 * working across provider modules that do not share a common exception
 * hierarchy.
 */
public final class LlmErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_CONTENT_FILTERED_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ContentFilteredException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_NON_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "NonRetriableException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");
    private static final Pattern RETRY_AFTER_PATTERN = Pattern.compile("retry[-_ ]after\"?\\s*[:=]?\\s*\"?(\\d+)",
            Pattern.CASE_INSENSITIVE);

    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_UNAUTHORIZED = 401;
    private static final int HTTP_FORBIDDEN = 403;
    private static final int HTTP_REQUEST_TIMEOUT = 408;
    private static final int HTTP_SERVER_ERROR = 500;
    private static final int HTTP_BAD_REQUEST = 400;

    private LlmErrorClassifier() {
    }

    public static AnalysisException classify(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (current instanceof AnalysisException analysisException) {
                return analysisException;
            }
            AnalysisException known = classifyKnownThrowable(current, throwable);
            if (known != null) {
                return known;
            }
            current = current.getCause();
        }
        if (isRateLimitMessage(throwable)) {
            return new AnalysisRateLimitedException(describe(throwable), extractRetryAfter(throwable), throwable);
        }
        return new AnalysisTransientException(describe(throwable), throwable);
    }

    private static AnalysisException classifyKnownThrowable(Throwable current, Throwable root) {
        if (current instanceof SocketTimeoutException
                || current instanceof HttpTimeoutException
                || current instanceof TimeoutException) {
            return new AnalysisTransientException(describe(root), root, true);
        }

        String className = current.getClass().getName();
        if (CLASS_RATE_LIMIT_EXCEPTION.equals(className)) {
            return new AnalysisRateLimitedException(describe(root), extractRetryAfter(root), root);
        }
        if (CLASS_AUTHENTICATION_EXCEPTION.equals(className)) {
            return new AnalysisAuthenticationException(describe(root), root);
        }
        if (CLASS_TIMEOUT_EXCEPTION.equals(className)) {
            return new AnalysisTransientException(describe(root), root, true);
        }
        if (CLASS_INTERNAL_SERVER_EXCEPTION.equals(className)) {
            return new AnalysisTransientException(describe(root), root);
        }
        if (CLASS_INVALID_REQUEST_EXCEPTION.equals(className)
                || CLASS_MODEL_NOT_FOUND_EXCEPTION.equals(className)
                || CLASS_CONTENT_FILTERED_EXCEPTION.equals(className)
                || CLASS_NON_RETRIABLE_EXCEPTION.equals(className)) {
            return new AnalysisException(describe(root), root);
        }
        if (CLASS_HTTP_EXCEPTION.equals(className)) {
            return classifyByStatus(readHttpStatusCode(current), root);
        }
        if (current instanceof IOException) {
            return new AnalysisTransientException(describe(root), root);
        }
        return null;
    }

    private static AnalysisException classifyByStatus(Integer statusCode, Throwable root) {
        if (statusCode == null) {
            return new AnalysisTransientException(describe(root), root);
        }
        if (statusCode == HTTP_TOO_MANY_REQUESTS) {
            return new AnalysisRateLimitedException(describe(root), extractRetryAfter(root), root);
        }
        if (statusCode == HTTP_UNAUTHORIZED || statusCode == HTTP_FORBIDDEN) {
            return new AnalysisAuthenticationException(describe(root), root);
        }
        if (statusCode == HTTP_REQUEST_TIMEOUT) {
            return new AnalysisTransientException(describe(root), root, true);
        }
        if (statusCode >= HTTP_SERVER_ERROR) {
            return new AnalysisTransientException(describe(root), root);
        }
        if (statusCode >= HTTP_BAD_REQUEST) {
            return new AnalysisException(describe(root), root);
        }
        return new AnalysisTransientException(describe(root), root);
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer status) {
                return status;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException e) {
            return null;
        }
        return null;
    }

    private static boolean isRateLimitMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null) {
                String normalized = msg.toLowerCase(Locale.ROOT);
                if (normalized.contains("rate_limit") || normalized.contains("too many requests")
                        || normalized.contains("overloaded")) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Server wait hint from a {@code reset_seconds} body field or a retry-after
     * value embedded in the error message.
     */
    static Duration extractRetryAfter(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null) {
                Long seconds = firstNumber(RESET_SECONDS_PATTERN.matcher(msg));
                if (seconds == null) {
                    seconds = firstNumber(RETRY_AFTER_PATTERN.matcher(msg));
                }
                if (seconds != null) {
                    return Duration.ofSeconds(seconds);
                }
            }
            current = current.getCause();
        }
        return null;
    }

    private static Long firstNumber(Matcher matcher) {
        if (!matcher.find()) {
            return null;
        }
        try {
            return Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return "LLM call failed: " + (message != null ? message : throwable.getClass().getSimpleName());
    }
}
