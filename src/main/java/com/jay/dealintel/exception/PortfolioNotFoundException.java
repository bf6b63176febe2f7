package com.jay.dealintel.exception;

public class PortfolioNotFoundException extends RuntimeException {

    public PortfolioNotFoundException(String integrationId) {
        super("Integration portfolio not found: " + integrationId);
    }
}
