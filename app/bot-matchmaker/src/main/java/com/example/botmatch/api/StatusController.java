package com.example.botmatch.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String index() {
    return "bot-matchmaker: ok";
  }
}
