package com.acme.workqueue.web;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Produces;

@Controller
public class HealthController {

  @Get("/health")
  @Produces(MediaType.APPLICATION_JSON)
  public HttpResponse<String> health() {
    return HttpResponse.ok("{\"status\":\"UP\"}");
  }
}
