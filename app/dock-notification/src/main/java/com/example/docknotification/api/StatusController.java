package com.example.docknotification.api;

import com.example.docknotification.service.NotificationSubsystem;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatusController {

  private final NotificationSubsystem subsystem;

  @GetMapping("/")
  public String home() {
    return "dock-notification: ok mode=" + subsystem.mode().value();
  }
}
