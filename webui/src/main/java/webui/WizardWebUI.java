package webui;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Точка входа в веб-интерфейс мастера анализа.
 *
 * <p>Возможности:
 * <ul>
 *   <li>Пошаговый мастер для каждого экрана анализа</li>
 *   <li>Обновления шага, состояния анализа и уведомлений через WebSocket</li>
 *   <li>Экспорт результата в CSV, PNG, DOCX, JSON и эталонный скрипт</li>
 * </ul>
 *
 * <p>Запуск: java -jar webui/target/analysis-wizard-webui.jar
 * <br>Доступ: http://localhost:8080
 */
@SpringBootApplication
public class WizardWebUI {

    public static void main(String[] args) {
        System.out.println("\n=================================================");
        System.out.println("  Analysis Wizard WebUI");
        System.out.println("  Running on Java " + System.getProperty("java.version"));
        System.out.println("=================================================\n");

        SpringApplication.run(WizardWebUI.class, args);
    }

    /**
     * Настройка Jackson ObjectMapper для сериализации JSON.
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    /**
     * CORS для локальной разработки фронтенда.
     */
    @Bean
    public WebMvcConfigurer corsConfigurer() {
        return new WebMvcConfigurer() {
            @Override
            public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/**")
                        .allowedOrigins(
                            "http://localhost:3000",
                            "http://localhost:8080",
                            "http://127.0.0.1:3000",
                            "http://127.0.0.1:8080"
                        )
                        .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                        .allowedHeaders("*")
                        .exposedHeaders("Content-Disposition")
                        .allowCredentials(true);
            }
        };
    }
}
