package com.geico.poc.kqlcompiler;

import com.geico.poc.kqlcompiler.dto.CompileRequest;
import com.geico.poc.kqlcompiler.dto.CompileResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/kql")
public class KqlController {

    @Autowired
    private KqlQueryService queryService;

    @PostMapping("/compile")
    public ResponseEntity<CompileResponse> compile(@RequestBody CompileRequest request) {
        if (request.getAst() == null || request.getAst().isNull()) {
            return ResponseEntity.badRequest().body(CompileResponse.error("Missing ast"));
        }
        return respond(queryService.compile(request.getAst()));
    }

    @PostMapping("/translate")
    public ResponseEntity<CompileResponse> translate(@RequestBody CompileRequest request) {
        return respond(queryService.translate(request.getQuery()));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static ResponseEntity<CompileResponse> respond(CompileResponse response) {
        return response.isSuccess() ? ResponseEntity.ok(response) : ResponseEntity.badRequest().body(response);
    }
}
