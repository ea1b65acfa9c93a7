package com.ctm.server.http;

import io.netty.handler.codec.http.HttpRequest;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Diagnostic page for unhandled request errors, only rendered in debug mode.
 */
final class ErrorPage {

    private ErrorPage() {}

    static String render(Throwable error, HttpRequest request) {
        StringWriter trace = new StringWriter();
        error.printStackTrace(new PrintWriter(trace));

        return "<!DOCTYPE html>\n<html><head><meta charset=\"utf-8\"><title>500 Internal Server Error</title></head>\n"
                + "<body>\n<h1>500 Internal Server Error</h1>\n"
                + "<h2>" + Html.escape(error.getClass().getName()) + ": " + Html.escape(error.getMessage()) + "</h2>\n"
                + "<h3>Request</h3>\n<pre>" + Html.escape(request.method() + " " + request.uri()) + "</pre>\n"
                + "<h3>Trace</h3>\n<pre>" + Html.escape(trace.toString()) + "</pre>\n"
                + "</body></html>\n";
    }
}
