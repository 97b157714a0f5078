package com.example.excelsplit.service;

import com.example.excelsplit.service.excel.ConfigException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 按处理类型保存的列配置。用户文件不存在时使用 classpath 下的 process-config.json，再退回内置默认值。
 */
@Slf4j
@Service
public class ProcessConfigService {

    static final String DEFAULTS_RESOURCE = "process-config.json";
    private static final TypeReference<Map<String, ProcessConfig>> CONFIG_MAP = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Path configFile;

    public ProcessConfigService(ObjectMapper objectMapper,
                                @Value("${excel.process.config-file:${user.home}/.liao-tools/excel_configs.json}")
                                String configFile) {
        this.objectMapper = objectMapper;
        this.configFile = Paths.get(configFile);
    }

    public Map<String, ProcessConfig> loadAll() {
        if (!Files.exists(configFile)) {
            return loadDefaults();
        }
        try (InputStream input = Files.newInputStream(configFile)) {
            Map<String, ProcessConfig> configs = objectMapper.readValue(input, CONFIG_MAP);
            return configs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(configs);
        } catch (IOException e) {
            throw new ConfigException("解析配置文件失败: " + e.getMessage(), e);
        }
    }

    public ProcessConfig loadFor(String processType) {
        ProcessType type = ProcessType.fromKey(processType);
        ProcessConfig config = loadAll().get(type.key());
        return config != null ? config : ProcessConfig.defaultFor(type);
    }

    public void save(ProcessConfig config) {
        if (config == null) {
            throw new ConfigException("配置不能为空");
        }
        config.validate();

        Map<String, ProcessConfig> configs = loadAll();
        configs.put(config.processType().key(), config);
        try {
            Path parent = configFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), configs);
        } catch (IOException e) {
            throw new ConfigException("写入配置文件失败: " + e.getMessage(), e);
        }
        log.info("已保存处理配置 {} -> {}", config.processType(), configFile);
    }

    private Map<String, ProcessConfig> loadDefaults() {
        Map<String, ProcessConfig> configs = new LinkedHashMap<>();
        for (ProcessType type : ProcessType.values()) {
            configs.put(type.key(), ProcessConfig.defaultFor(type));
        }
        ClassPathResource resource = new ClassPathResource(DEFAULTS_RESOURCE);
        if (!resource.exists()) {
            return configs;
        }
        try (InputStream input = resource.getInputStream()) {
            Map<String, ProcessConfig> bundled = objectMapper.readValue(input, CONFIG_MAP);
            if (bundled != null) {
                configs.putAll(bundled);
            }
            return configs;
        } catch (IOException e) {
            throw new ConfigException("默认配置读取失败: " + e.getMessage(), e);
        }
    }
}
