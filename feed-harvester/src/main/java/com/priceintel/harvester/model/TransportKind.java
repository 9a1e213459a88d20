package com.priceintel.harvester.model;

public enum TransportKind {
    HTTP, HTTP_BASIC_AUTH, FTP, FTPS, PUSH_UPLOAD
}
