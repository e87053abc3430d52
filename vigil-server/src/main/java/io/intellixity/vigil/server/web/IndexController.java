package io.intellixity.vigil.server.web;

import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.governance.Governance;
import io.intellixity.vigil.lifecycle.IndexLifecycleOrchestrator;
import io.intellixity.vigil.lifecycle.IndexesToCreate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public final class IndexController {
  private final IndexLifecycleOrchestrator lifecycle;

  public IndexController(IndexLifecycleOrchestrator lifecycle) {
    this.lifecycle = lifecycle;
  }

  public record CreateIndexesRequest(List<ConcreteIndex> indexes) {}

  /** Indexes the iteration still needs before it can be published. */
  @GetMapping("/scenario-iterations/{iterationId}/indexes")
  public IndexesToCreate indexesToCreate(@PathVariable("iterationId") String iterationId) {
    return lifecycle.getIndexesToCreate(organizationId(), iterationId);
  }

  @PostMapping("/indexes")
  public ResponseEntity<List<ConcreteIndex>> create(@RequestBody CreateIndexesRequest req) {
    List<ConcreteIndex> indexes = req == null || req.indexes() == null ? List.of() : req.indexes();
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(lifecycle.createIndexesAsync(organizationId(), indexes));
  }

  @GetMapping("/indexes")
  public List<ConcreteIndex> list(@RequestParam(name = "valid", defaultValue = "false") boolean validOnly) {
    return lifecycle.listIndexes(organizationId(), validOnly);
  }

  private static String organizationId() {
    return Governance.currentOrThrow().organizationId();
  }
}
