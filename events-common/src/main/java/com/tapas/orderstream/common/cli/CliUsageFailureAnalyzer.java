package com.tapas.orderstream.common.cli;

import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.diagnostics.AbstractFailureAnalyzer;
import org.springframework.boot.diagnostics.FailureAnalysis;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;

import java.util.stream.Collectors;

/**
 * Turns a failed validation of command-line backed properties into a readable
 * list of bad flags plus the service's usage text. Each service registers a
 * subclass in META-INF/spring.factories.
 */
public abstract class CliUsageFailureAnalyzer extends AbstractFailureAnalyzer<BindValidationException> {

    protected abstract String usage();

    @Override
    protected FailureAnalysis analyze(Throwable rootFailure, BindValidationException cause) {
        String problems = cause.getValidationErrors().getAllErrors().stream()
                .map(CliUsageFailureAnalyzer::describe)
                .collect(Collectors.joining(System.lineSeparator()));
        return new FailureAnalysis(
                "Invalid command line:" + System.lineSeparator() + problems,
                usage(),
                cause);
    }

    static String describe(ObjectError error) {
        if (error instanceof FieldError) {
            FieldError fieldError = (FieldError) error;
            return "  --" + toFlag(fieldError.getField()) + ": " + fieldError.getDefaultMessage()
                    + " (was '" + fieldError.getRejectedValue() + "')";
        }
        return "  " + error.getDefaultMessage();
    }

    static String toFlag(String field) {
        StringBuilder flag = new StringBuilder(field.length() + 4);
        for (char c : field.toCharArray()) {
            if (Character.isUpperCase(c)) {
                flag.append('-').append(Character.toLowerCase(c));
            } else {
                flag.append(c);
            }
        }
        return flag.toString();
    }
}
