package http;

/**
 * Интерфейс HTTP-клиента для обращения к внешним сервисам мастера анализа:
 * вычислительному сервису, сервису рендеринга документов и репозиторию скриптов.
 *
 * <p>Реализации не должны выбрасывать исключения транспортного уровня:
 * любая ошибка соединения возвращается как {@link ServiceResponse} с кодом 0
 * и заполненным полем ошибки.
 *
 * <p>Основные реализации:
 * <ul>
 *   <li>{@link StandardHttpClient} - клиент на базе {@code HttpURLConnection}</li>
 * </ul>
 */
public interface HttpClient extends AutoCloseable {

    /**
     * Выполняет HTTP-запрос и возвращает ответ.
     *
     * @param request запрос к сервису
     * @return ответ сервиса (никогда не null)
     */
    ServiceResponse execute(ServiceRequest request);

    /**
     * Проверяет, поддерживает ли этот клиент указанную схему URL.
     *
     * @param url URL для проверки
     * @return true, если поддерживается, иначе false
     */
    boolean supports(String url);

    /**
     * Закрывает клиент и освобождает удерживаемые ресурсы.
     */
    @Override
    void close();
}
