/*
 * Where: Funnel API
 * What: Reads and flips the global automation switch, and runs a pass on demand
 * Why: Operators pause sending or replay a tick without redeploying
 */
package com.example.funnel.api;

import com.example.funnel.service.AutomationSettings;
import com.example.funnel.service.AutomationStepRunner;
import com.example.funnel.service.EmailJobRunner;
import com.example.funnel.service.EnrollmentScheduler;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
public class AutomationAdminController {

  private final AutomationSettings automationSettings;
  private final EmailJobRunner emailJobRunner;
  private final AutomationStepRunner automationStepRunner;
  private final EnrollmentScheduler enrollmentScheduler;

  @GetMapping("/email-automation")
  public AutomationSwitchResponse get() {
    return new AutomationSwitchResponse(automationSettings.isEnabled());
  }

  @PutMapping("/email-automation")
  public AutomationSwitchResponse put(@Valid @RequestBody AutomationSwitchRequest request) {
    automationSettings.setEnabled(request.enabled());
    return new AutomationSwitchResponse(request.enabled());
  }

  @PostMapping("/runs/{pass}")
  public Object run(@PathVariable("pass") String pass) {
    return switch (pass) {
      case "jobs" -> emailJobRunner.runOnce();
      case "automation" -> automationStepRunner.runOnce();
      case "enrollments" -> enrollmentScheduler.runOnce();
      default -> throw new UnknownPassException(pass);
    };
  }
}
