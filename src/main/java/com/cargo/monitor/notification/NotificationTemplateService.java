package com.cargo.monitor.notification;

import com.cargo.monitor.model.ExceptionType;
import com.cargo.monitor.model.Language;
import com.cargo.monitor.model.NotificationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Subject/body templates keyed by (template key, language).
 *
 * Template keys are customer notification kinds ({@code departed}, {@code delayed}, ...) or
 * exception types prefixed with {@code exception.} ({@code exception.delay}, ...).
 * Placeholders use {@code {name}} and are substituted from the render context in a single
 * pass over the template; unknown placeholders are left in place and substituted values are
 * never expanded again.
 *
 * Exception templates are localised in subject and body. The rule's evidence line
 * ({@code {message}}) is always English and is embedded as-is.
 */
@Service
public class NotificationTemplateService {

    private static final Logger log = LoggerFactory.getLogger(NotificationTemplateService.class);

    public static final String EXCEPTION_PREFIX = "exception.";

    private static final String SIGNATURE_EN = "\n\nBest regards,\nCW Logistics Team";
    private static final String SIGNATURE_ES = "\n\nAtentamente,\nEquipo de CW Logistics";
    private static final String SIGNATURE_ZH = "\n\n此致\nCW Logistics 团队";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private final Map<String, Map<Language, RenderedMessage>> templates = new HashMap<>();

    public NotificationTemplateService() {
        registerCustomerTemplates();
        registerExceptionTemplates();
    }

    public static String keyFor(NotificationKind kind) {
        return kind.getCode();
    }

    public static String keyFor(ExceptionType type) {
        return EXCEPTION_PREFIX + type.getWireName();
    }

    /**
     * Render a template. Unknown keys fall back to {@code in_transit}; missing translations
     * fall back to English.
     */
    public RenderedMessage render(String templateKey, Language language, Map<String, String> context) {
        Map<Language, RenderedMessage> byLanguage = templates.get(templateKey);
        if (byLanguage == null) {
            log.warn("Unknown template {}, using in_transit", templateKey);
            byLanguage = templates.get(keyFor(NotificationKind.IN_TRANSIT));
        }

        RenderedMessage template = byLanguage.get(language);
        if (template == null) {
            log.warn("Template {} has no {} translation, using English", templateKey, language.getCode());
            template = byLanguage.get(Language.EN);
        }

        return new RenderedMessage(
                substitute(template.subject(), context),
                substitute(template.body(), context));
    }

    public boolean hasTemplate(String templateKey, Language language) {
        Map<Language, RenderedMessage> byLanguage = templates.get(templateKey);
        return byLanguage != null && byLanguage.containsKey(language);
    }

    static String substitute(String text, Map<String, String> context) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder(text.length());
        while (matcher.find()) {
            String value = context.get(matcher.group(1));
            matcher.appendReplacement(result, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private void register(String key, Language language, String subject, String body) {
        String signature = switch (language) {
            case EN -> SIGNATURE_EN;
            case ES -> SIGNATURE_ES;
            case ZH -> SIGNATURE_ZH;
        };
        registerPlain(key, language, subject, body + signature);
    }

    // Operator-facing messages for the exception handler carry no customer signature
    private void registerPlain(String key, Language language, String subject, String body) {
        templates.computeIfAbsent(key, k -> new EnumMap<>(Language.class))
                .put(language, new RenderedMessage(subject, body));
    }

    private void registerCustomerTemplates() {
        String departed = keyFor(NotificationKind.DEPARTED);
        register(departed, Language.EN, "Your shipment {shipment_id} has departed",
                "Dear Customer,\n\nYour shipment {shipment_id} has departed from {origin} and is now on its way to {destination}.\n\n"
                        + "Container: {container}\nTrack your shipment: {tracking_url}");
        register(departed, Language.ES, "Su envío {shipment_id} ha salido",
                "Estimado cliente,\n\nSu envío {shipment_id} ha salido de {origin} y está en camino a {destination}.\n\n"
                        + "Contenedor: {container}\nSiga su envío: {tracking_url}");
        register(departed, Language.ZH, "您的货件 {shipment_id} 已启运",
                "尊敬的客户：\n\n您的货件 {shipment_id} 已从 {origin} 启运，正在前往 {destination}。\n\n"
                        + "集装箱：{container}\n跟踪货件：{tracking_url}");

        String inTransit = keyFor(NotificationKind.IN_TRANSIT);
        register(inTransit, Language.EN, "Shipment {shipment_id} is in transit",
                "Dear Customer,\n\nYour shipment {shipment_id} is currently in transit from {origin} to {destination}.\n\n"
                        + "Container: {container}\nTrack your shipment: {tracking_url}");
        register(inTransit, Language.ES, "El envío {shipment_id} está en tránsito",
                "Estimado cliente,\n\nSu envío {shipment_id} está en tránsito de {origin} a {destination}.\n\n"
                        + "Contenedor: {container}\nSiga su envío: {tracking_url}");
        register(inTransit, Language.ZH, "货件 {shipment_id} 运输中",
                "尊敬的客户：\n\n您的货件 {shipment_id} 正在从 {origin} 运往 {destination}。\n\n"
                        + "集装箱：{container}\n跟踪货件：{tracking_url}");

        String arrived = keyFor(NotificationKind.ARRIVED);
        register(arrived, Language.EN, "Shipment {shipment_id} has arrived at {destination}",
                "Dear Customer,\n\nYour shipment {shipment_id} has arrived at {destination}. "
                        + "It will now proceed to customs clearance.\n\nTrack your shipment: {tracking_url}");
        register(arrived, Language.ES, "El envío {shipment_id} ha llegado a {destination}",
                "Estimado cliente,\n\nSu envío {shipment_id} ha llegado a {destination}. "
                        + "Ahora pasará al despacho de aduanas.\n\nSiga su envío: {tracking_url}");
        register(arrived, Language.ZH, "货件 {shipment_id} 已抵达 {destination}",
                "尊敬的客户：\n\n您的货件 {shipment_id} 已抵达 {destination}，即将进入清关流程。\n\n跟踪货件：{tracking_url}");

        String cleared = keyFor(NotificationKind.CUSTOMS_CLEARED);
        register(cleared, Language.EN, "Shipment {shipment_id} cleared customs",
                "Dear Customer,\n\nYour shipment {shipment_id} has cleared customs and is being prepared for final delivery.\n\n"
                        + "Track your shipment: {tracking_url}");
        register(cleared, Language.ES, "El envío {shipment_id} pasó la aduana",
                "Estimado cliente,\n\nSu envío {shipment_id} ha pasado la aduana y se está preparando para la entrega final.\n\n"
                        + "Siga su envío: {tracking_url}");
        register(cleared, Language.ZH, "货件 {shipment_id} 已清关",
                "尊敬的客户：\n\n您的货件 {shipment_id} 已完成清关，正在安排最终派送。\n\n跟踪货件：{tracking_url}");

        String delivered = keyFor(NotificationKind.DELIVERED);
        register(delivered, Language.EN, "Shipment {shipment_id} has been delivered",
                "Dear Customer,\n\nYour shipment {shipment_id} has been delivered to {destination}.\n\n"
                        + "Thank you for choosing CW Logistics.");
        register(delivered, Language.ES, "El envío {shipment_id} ha sido entregado",
                "Estimado cliente,\n\nSu envío {shipment_id} ha sido entregado en {destination}.\n\n"
                        + "Gracias por elegir CW Logistics.");
        register(delivered, Language.ZH, "货件 {shipment_id} 已送达",
                "尊敬的客户：\n\n您的货件 {shipment_id} 已送达 {destination}。\n\n感谢您选择 CW Logistics。");

        String delayed = keyFor(NotificationKind.DELAYED);
        register(delayed, Language.EN, "Important: Shipment {shipment_id} may be delayed",
                "Dear Customer,\n\nYour shipment {shipment_id} may experience a delay.\n\n"
                        + "Reason: {delay_reason}\nPrediction confidence: {ml_confidence}\nRisk factors: {risk_factors}\n"
                        + "Expected delay: {predicted_delay}\n\n{action_recommended}\n\nTrack your shipment: {tracking_url}");
        register(delayed, Language.ES, "Importante: el envío {shipment_id} podría retrasarse",
                "Estimado cliente,\n\nSu envío {shipment_id} podría sufrir un retraso.\n\n"
                        + "Motivo: {delay_reason}\nConfianza de la predicción: {ml_confidence}\nFactores de riesgo: {risk_factors}\n"
                        + "Retraso previsto: {predicted_delay}\n\n{action_recommended}\n\nSiga su envío: {tracking_url}");
        register(delayed, Language.ZH, "重要：货件 {shipment_id} 可能延误",
                "尊敬的客户：\n\n您的货件 {shipment_id} 可能出现延误。\n\n"
                        + "原因：{delay_reason}\n预测置信度：{ml_confidence}\n风险因素：{risk_factors}\n"
                        + "预计延误：{predicted_delay}\n\n{action_recommended}\n\n跟踪货件：{tracking_url}");

        String exception = keyFor(NotificationKind.EXCEPTION);
        register(exception, Language.EN, "Attention: Exception for shipment {shipment_id}",
                "Dear Customer,\n\nAn exception has been detected for your shipment {shipment_id}.\n\n"
                        + "Issue: {exception_details}\n\nOur team is investigating.\n\nTrack your shipment: {tracking_url}");
        register(exception, Language.ES, "Atención: incidencia en el envío {shipment_id}",
                "Estimado cliente,\n\nSe ha detectado una incidencia en su envío {shipment_id}.\n\n"
                        + "Problema: {exception_details}\n\nNuestro equipo lo está investigando.\n\nSiga su envío: {tracking_url}");
        register(exception, Language.ZH, "注意：货件 {shipment_id} 出现异常",
                "尊敬的客户：\n\n您的货件 {shipment_id} 检测到异常。\n\n"
                        + "问题：{exception_details}\n\n我们的团队正在调查。\n\n跟踪货件：{tracking_url}");
    }

    private void registerExceptionTemplates() {
        String delay = keyFor(ExceptionType.DELAY);
        registerPlain(delay, Language.EN, "[{severity}] Delay on shipment {shipment_id}", "{message}");
        registerPlain(delay, Language.ES, "[{severity}] Retraso en el envío {shipment_id}",
                "El envío {shipment_id} acumula retraso sobre su ETA programada.\nDetalle técnico: {message}");
        registerPlain(delay, Language.ZH, "[{severity}] 货件 {shipment_id} 延误",
                "货件 {shipment_id} 已晚于计划到港时间。\n技术详情：{message}");

        String ml = keyFor(ExceptionType.ML_PREDICTION);
        registerPlain(ml, Language.EN, "[{severity}] Predicted delay on shipment {shipment_id}", "{message}");
        registerPlain(ml, Language.ES, "[{severity}] Retraso previsto en el envío {shipment_id}",
                "El modelo de riesgo prevé un retraso para el envío {shipment_id}.\nDetalle técnico: {message}");
        registerPlain(ml, Language.ZH, "[{severity}] 货件 {shipment_id} 预测延误",
                "风险模型预测货件 {shipment_id} 将会延误。\n技术详情：{message}");

        String temperature = keyFor(ExceptionType.TEMPERATURE_DEVIATION);
        registerPlain(temperature, Language.EN, "[{severity}] Temperature deviation on shipment {shipment_id}", "{message}");
        registerPlain(temperature, Language.ES, "[{severity}] Desviación de temperatura en el envío {shipment_id}",
                "La temperatura del contenedor refrigerado del envío {shipment_id} se ha desviado de la consigna.\nDetalle técnico: {message}");
        registerPlain(temperature, Language.ZH, "[{severity}] 货件 {shipment_id} 温度偏差",
                "货件 {shipment_id} 的冷藏集装箱温度偏离设定值。\n技术详情：{message}");

        String geofence = keyFor(ExceptionType.GEOFENCE_VIOLATION);
        registerPlain(geofence, Language.EN, "[{severity}] Route deviation on shipment {shipment_id}", "{message}");
        registerPlain(geofence, Language.ES, "[{severity}] Desvío de ruta en el envío {shipment_id}",
                "El envío {shipment_id} está fuera del corredor de ruta previsto.\nDetalle técnico: {message}");
        registerPlain(geofence, Language.ZH, "[{severity}] 货件 {shipment_id} 偏离航线",
                "货件 {shipment_id} 已偏离预定航线走廊。\n技术详情：{message}");

        String milestone = keyFor(ExceptionType.MISSING_MILESTONE);
        registerPlain(milestone, Language.EN, "[{severity}] Missing milestone on shipment {shipment_id}", "{message}");
        registerPlain(milestone, Language.ES, "[{severity}] Hito pendiente en el envío {shipment_id}",
                "El envío {shipment_id} no ha registrado ningún hito en el plazo esperado.\nDetalle técnico: {message}");
        registerPlain(milestone, Language.ZH, "[{severity}] 货件 {shipment_id} 里程碑缺失",
                "货件 {shipment_id} 在预期时间内未记录任何里程碑。\n技术详情：{message}");
    }
}
