package com.example.importer.gateway;

@FunctionalInterface
public interface DatabaseGatewayFactory {

    DatabaseGateway open();
}
