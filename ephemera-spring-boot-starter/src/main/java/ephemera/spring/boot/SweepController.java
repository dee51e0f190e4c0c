package ephemera.spring.boot;

import ephemera.model.SweepResult;
import ephemera.sweep.ExpiredContentSweeper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Trigger endpoint for an on-demand sweep, for use by an external cron.
 *
 * <p>Responds 200 when every step succeeded, 207 when some steps failed and 500 when the
 * expired-items query failed or the sweep itself threw.
 */
@RestController
public class SweepController {

  private static final Logger log = LoggerFactory.getLogger(SweepController.class);

  private final ExpiredContentSweeper sweeper;

  public SweepController(ExpiredContentSweeper sweeper) {
    this.sweeper = sweeper;
  }

  @PostMapping("${ephemera.endpoint.path:/internal/sweeps}")
  public ResponseEntity<Map<String, Object>> sweep() {
    SweepResult result;
    try {
      result = sweeper.sweep();
    } catch (RuntimeException e) {
      log.error("Sweep failed", e);
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("success", false);
      body.put("error", String.valueOf(e.getMessage()));
      body.put("message", "Fatal error occurred during sweep");
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }
    log.info("Sweep triggered over HTTP: {}", result.message());
    return ResponseEntity.status(result.outcome().httpStatus()).body(result.toResponseBody());
  }
}
