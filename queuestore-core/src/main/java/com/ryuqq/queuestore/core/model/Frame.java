package com.ryuqq.queuestore.core.model;

import com.ryuqq.queuestore.core.spi.MessageIdGenerator;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 전송 중인 메시지 한 건 (헤더 + 본문).
 *
 * <p>Frame은 브로커가 생성하여 저장소에 넘기고, 큐에 머무는 동안은 저장소가 독점 소유하며,
 * dequeue 시 소유권이 다시 브로커로 돌아갑니다. 저장소가 Frame에 쓰는 유일한 값은
 * {@value #MESSAGE_ID} 헤더입니다.</p>
 *
 * <p><strong>message-id 불변식:</strong></p>
 * <ul>
 *   <li>한 번 설정된 message-id는 변경하거나 제거할 수 없음</li>
 *   <li>requeue된 Frame은 같은 논리 메시지의 재전달이므로 동일한 message-id 유지</li>
 *   <li>enqueue 전에 브로커가 직접 설정할 수도 있음 (선택)</li>
 * </ul>
 *
 * <p><strong>스레드 안전성:</strong> 동기화하지 않습니다. 소유권 규칙상 한 시점에
 * 하나의 소유자만 Frame에 접근합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Frame frame = Frame.ofText("{\"orderId\":123}");
 * frame.setHeader("content-type", "application/json");
 *
 * storage.enqueue("orders", frame);
 * frame.getMessageId(); // Optional[MessageId{...}]
 * </pre>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public final class Frame {

    /**
     * 저장소가 할당하는 메시지 식별자 헤더 이름.
     */
    public static final String MESSAGE_ID = "message-id";

    private static final byte[] EMPTY_BODY = new byte[0];

    private final Map<String, String> headers;
    private final byte[] body;

    /**
     * 헤더 없는 Frame 생성.
     *
     * @param body 본문 (null이면 빈 본문)
     */
    public Frame(byte[] body) {
        this(Map.of(), body);
    }

    /**
     * 헤더와 본문으로 Frame 생성.
     *
     * @param headers 초기 헤더 (null 불가, 복사됨)
     * @param body 본문 (null이면 빈 본문, 복사됨)
     * @throws IllegalArgumentException 헤더 이름이나 값이 유효하지 않은 경우
     */
    public Frame(Map<String, String> headers, byte[] body) {
        if (headers == null) {
            throw new IllegalArgumentException("headers cannot be null");
        }
        this.headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            putHeader(entry.getKey(), entry.getValue());
        }
        this.body = body == null ? EMPTY_BODY : body.clone();
    }

    /**
     * UTF-8 텍스트 본문으로 Frame 생성.
     *
     * @param text 본문 텍스트 (null이면 빈 본문)
     * @return Frame 인스턴스
     */
    public static Frame ofText(String text) {
        return new Frame(text == null ? EMPTY_BODY : text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 헤더 값 조회.
     *
     * @param name 헤더 이름
     * @return 헤더 값 (없으면 null)
     */
    public String getHeader(String name) {
        return headers.get(name);
    }

    /**
     * 헤더 존재 여부 확인.
     *
     * @param name 헤더 이름
     * @return 존재하면 true
     */
    public boolean hasHeader(String name) {
        return headers.containsKey(name);
    }

    /**
     * 헤더 설정.
     *
     * <p>{@value #MESSAGE_ID}는 아직 설정되지 않은 경우에만 설정할 수 있습니다.</p>
     *
     * @param name 헤더 이름 (null/빈 문자열 불가)
     * @param value 헤더 값 (null 불가)
     * @throws IllegalArgumentException 이름이나 값이 유효하지 않은 경우
     * @throws IllegalStateException 이미 설정된 message-id를 덮어쓰려는 경우
     */
    public void setHeader(String name, String value) {
        putHeader(name, value);
    }

    /**
     * 헤더 제거.
     *
     * @param name 헤더 이름
     * @return 제거된 값 (없었으면 null)
     * @throws IllegalStateException message-id를 제거하려는 경우
     */
    public String removeHeader(String name) {
        if (MESSAGE_ID.equals(name) && headers.containsKey(MESSAGE_ID)) {
            throw new IllegalStateException("message-id cannot be removed once assigned");
        }
        return headers.remove(name);
    }

    /**
     * 전체 헤더 조회 (읽기 전용 뷰).
     *
     * @return 헤더 맵
     */
    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    /**
     * 본문 조회 (복사본).
     *
     * @return 본문 바이트
     */
    public byte[] getBody() {
        return body.clone();
    }

    /**
     * 본문을 UTF-8 텍스트로 조회.
     *
     * @return 본문 텍스트
     */
    public String getBodyAsText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * 본문 길이.
     *
     * @return 바이트 수
     */
    public int getBodyLength() {
        return body.length;
    }

    /**
     * 할당된 message-id 조회.
     *
     * @return message-id (미할당이면 empty)
     */
    public Optional<MessageId> getMessageId() {
        String value = headers.get(MESSAGE_ID);
        return value == null ? Optional.empty() : Optional.of(MessageId.of(value));
    }

    /**
     * message-id가 없으면 생성기로 할당.
     *
     * <p>이미 있으면 기존 값을 그대로 반환하고 생성기를 호출하지 않습니다.
     * 저장소가 Frame에 쓰는 유일한 경로입니다.</p>
     *
     * @param generator message-id 생성기
     * @return 기존 또는 새로 할당된 message-id
     * @throws IllegalArgumentException generator가 null이거나 null을 반환한 경우
     */
    public MessageId assignMessageIdIfAbsent(MessageIdGenerator generator) {
        if (generator == null) {
            throw new IllegalArgumentException("generator cannot be null");
        }
        Optional<MessageId> existing = getMessageId();
        if (existing.isPresent()) {
            return existing.get();
        }
        MessageId messageId = generator.next();
        if (messageId == null) {
            throw new IllegalArgumentException("generator returned null MessageId");
        }
        headers.put(MESSAGE_ID, messageId.getValue());
        return messageId;
    }

    private void putHeader(String name, String value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Header name cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("Header value cannot be null (header: " + name + ")");
        }
        if (MESSAGE_ID.equals(name)) {
            String current = headers.get(MESSAGE_ID);
            if (current != null && !current.equals(value)) {
                throw new IllegalStateException(
                    "message-id is immutable once assigned (current: " + current + ", attempted: " + value + ")"
                );
            }
            // 형식 검증
            MessageId.of(value);
        }
        headers.put(name, value);
    }

    @Override
    public String toString() {
        return "Frame{headers=" + headers + ", body=" + body.length + " bytes}";
    }
}
