package com.acme.workqueue.web;

public record IdResponse(long id) {}
