package com.example.excelsplit.web;

import com.example.excelsplit.service.ExcelProcessService;
import com.example.excelsplit.service.ProcessConfig;
import com.example.excelsplit.service.ProcessConfigService;
import com.example.excelsplit.service.ProcessRequest;
import com.example.excelsplit.service.ProcessResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/excel")
@RequiredArgsConstructor
public class ExcelProcessController {

    private final ExcelProcessService excelProcessService;
    private final ProcessConfigService processConfigService;

    @PostMapping("/process")
    public ProcessResponse process(@RequestBody ProcessRequest request) {
        return excelProcessService.process(request);
    }

    @GetMapping("/config/{processType}")
    public ProcessConfig getConfig(@PathVariable("processType") String processType) {
        return processConfigService.loadFor(processType);
    }

    @PutMapping("/config")
    public ResponseEntity<Void> saveConfig(@RequestBody ProcessConfig config) {
        processConfigService.save(config);
        return ResponseEntity.noContent().build();
    }
}
