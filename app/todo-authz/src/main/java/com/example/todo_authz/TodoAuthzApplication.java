package com.example.todo_authz;

import com.example.todo_authz.config.OwnershipProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication
@EnableConfigurationProperties(OwnershipProperties.class)
@RestController
public class TodoAuthzApplication {

  @Value("${spring.application.name:todo-authz}")
  private String applicationName;

  public static void main(String[] args) {
    SpringApplication.run(TodoAuthzApplication.class, args);
  }

  @GetMapping({"/", "/health"})
  public String health() {
    return "OK from " + applicationName;
  }
}
