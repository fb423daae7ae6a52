package com.notionexport.core.exception;

/**
 * Thrown when a string does not contain a recognizable page or block id.
 *
 * <p>Fatal when raised for the root of an export: without a root id there is nothing to crawl.
 */
public class InvalidIdentityException extends ExportException {

    private final String input;

    public InvalidIdentityException(String input) {
        super("Could not find a Notion page id in: " + input);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
