package com.example.funnel.api;

import com.example.funnel.service.EmailJobRunner;
import com.example.funnel.service.NewEmailJob;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class EmailJobController {

  private final EmailJobRunner emailJobRunner;

  @PostMapping("/email-jobs")
  public ResponseEntity<EmailJobResponse> enqueue(@Valid @RequestBody EmailJobRequest request) {
    final UUID id =
        emailJobRunner.enqueue(
            new NewEmailJob(
                request.userId(),
                request.toEmail(),
                request.templateKey(),
                request.subject(),
                request.text(),
                request.html(),
                request.scheduledAt(),
                request.variables()));
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(new EmailJobResponse(id.toString()));
  }
}
