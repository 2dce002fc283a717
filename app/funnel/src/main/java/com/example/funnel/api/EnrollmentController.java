package com.example.funnel.api;

import com.example.funnel.service.EnrollmentScheduler;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class EnrollmentController {

  private final EnrollmentScheduler enrollmentScheduler;

  /** Idempotent: enrolling twice returns the existing enrollment. */
  @PostMapping("/enrollments")
  public EnrollmentResponse enroll(@Valid @RequestBody EnrollmentRequest request) {
    return EnrollmentResponse.from(
        enrollmentScheduler.enroll(request.userId(), request.sequenceKey(), request.context()));
  }
}
