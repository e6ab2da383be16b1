package com.example.formulamap.controller;

import com.example.formulamap.dto.DependencyAnalysisResult;
import com.example.formulamap.dto.DocumentText;
import com.example.formulamap.dto.ExtractFormulasResult;
import com.example.formulamap.dto.ExtractionOptions;
import com.example.formulamap.dto.FormulaAnalysisRequest;
import com.example.formulamap.dto.RoleAnalysisResult;
import com.example.formulamap.dto.VariableAnalysisResult;
import com.example.formulamap.dto.VariableOutputFormat;
import com.example.formulamap.dto.diagram.DiagramDirection;
import com.example.formulamap.service.FormulaAnalysisService;
import com.example.formulamap.service.ai.MultiProviderAiService;
import com.example.formulamap.service.text.DocumentReadException;
import com.example.formulamap.service.text.TextSourceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

@RestController
@RequestMapping("/api/formulas")
public class FormulaController {

    private static final Logger logger = LoggerFactory.getLogger(FormulaController.class);

    @Autowired
    private FormulaAnalysisService formulaAnalysisService;

    @Autowired
    private TextSourceResolver textSourceResolver;

    @Autowired(required = false)
    private MultiProviderAiService multiProviderAiService;

    @PostMapping("/extract")
    public ResponseEntity<?> extract(@RequestBody FormulaAnalysisRequest request) {
        return respond(() -> {
            ExtractFormulasResult result = formulaAnalysisService.extractFormulas(request.toDocumentText(), request.getOptions());
            return status(result.isSuccess(), result);
        });
    }

    @PostMapping("/dependencies")
    public ResponseEntity<?> dependencies(@RequestBody FormulaAnalysisRequest request) {
        return respond(() -> {
            DependencyAnalysisResult result = formulaAnalysisService.analyzeDependencies(request.toDocumentText(), request.getOptions());
            return status(result.isSuccess(), result);
        });
    }

    @PostMapping("/variables")
    public ResponseEntity<?> variables(@RequestBody FormulaAnalysisRequest request) {
        return respond(() -> {
            VariableAnalysisResult result = formulaAnalysisService.analyzeVariables(request.toDocumentText(), request.getOptions());
            return status(result.isSuccess(), result);
        });
    }

    @PostMapping("/roles")
    public ResponseEntity<?> roles(@RequestBody FormulaAnalysisRequest request) {
        return respond(() -> {
            RoleAnalysisResult result = formulaAnalysisService.analyzeRoles(request.toDocumentText(), request.getOptions());
            return status(result.isSuccess(), result);
        });
    }

    /**
     * Runs one analysis (extract, dependencies, variables or roles) on an uploaded file.
     */
    @PostMapping("/pdf/{analysis}")
    public ResponseEntity<?> analyzeUpload(
            @PathVariable("analysis") String analysis,
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "includeInline", defaultValue = "true") boolean includeInline,
            @RequestParam(value = "numberedOnly", defaultValue = "false") boolean numberedOnly,
            @RequestParam(value = "filterSection", required = false) String filterSection,
            @RequestParam(value = "filterSymbols", required = false) List<String> filterSymbols,
            @RequestParam(value = "direction", required = false) String direction,
            @RequestParam(value = "format", required = false) String format,
            @RequestParam(value = "useAi", defaultValue = "true") boolean useAi) {

        Function<DocumentText, ResponseEntity<?>> runner = runnerFor(analysis, ExtractionOptions.builder()
            .includeInline(includeInline)
            .numberedOnly(numberedOnly)
            .filterSection(filterSection)
            .filterSymbols(filterSymbols)
            .direction(DiagramDirection.fromString(direction, DiagramDirection.TB))
            .variableOutputFormat(VariableOutputFormat.fromString(format))
            .useAiInference(useAi)
            .build());
        if (runner == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "Unknown analysis: " + analysis));
        }
        if (file == null || file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "File is required"));
        }

        return respond(() -> {
            DocumentText document;
            try {
                document = textSourceResolver.read(file.getBytes(), file.getOriginalFilename(), file.getContentType());
            } catch (DocumentReadException e) {
                logger.warn("Could not read upload {}: {}", file.getOriginalFilename(), e.getMessage());
                return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
            }
            return runner.apply(document);
        });
    }

    @GetMapping("/providers")
    public ResponseEntity<Map<String, Object>> providers() {
        if (multiProviderAiService == null) {
            return ResponseEntity.ok(Map.of("available", false, "statistics", "No providers configured"));
        }
        return ResponseEntity.ok(Map.of(
            "available", multiProviderAiService.hasAvailableProvider(),
            "statistics", multiProviderAiService.getStatistics()));
    }

    private Function<DocumentText, ResponseEntity<?>> runnerFor(String analysis, ExtractionOptions options) {
        switch (analysis) {
            case "extract": {
                return document -> {
                    ExtractFormulasResult result = formulaAnalysisService.extractFormulas(document, options);
                    return status(result.isSuccess(), result);
                };
            }
            case "dependencies": {
                return document -> {
                    DependencyAnalysisResult result = formulaAnalysisService.analyzeDependencies(document, options);
                    return status(result.isSuccess(), result);
                };
            }
            case "variables": {
                return document -> {
                    VariableAnalysisResult result = formulaAnalysisService.analyzeVariables(document, options);
                    return status(result.isSuccess(), result);
                };
            }
            case "roles": {
                return document -> {
                    RoleAnalysisResult result = formulaAnalysisService.analyzeRoles(document, options);
                    return status(result.isSuccess(), result);
                };
            }
            default:
                return null;
        }
    }

    private static ResponseEntity<?> status(boolean success, Object body) {
        return success ? ResponseEntity.ok(body) : ResponseEntity.badRequest().body(body);
    }

    private ResponseEntity<?> respond(Handler handler) {
        try {
            return handler.handle();
        } catch (Exception e) {
            logger.error("Request failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", e.getMessage() != null ? e.getMessage() : "Internal server error"));
        }
    }

    @FunctionalInterface
    private interface Handler {
        ResponseEntity<?> handle() throws Exception;
    }
}
