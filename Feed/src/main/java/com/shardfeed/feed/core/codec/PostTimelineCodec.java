package com.shardfeed.feed.core.codec;

import com.shardfeed.feed.core.exception.CodecException;
import com.shardfeed.feed.service.feed.Engagement;
import com.shardfeed.feed.service.feed.PostCandidate;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 사용자 최근 게시물 타임라인 바이너리 포맷 (Little Endian)
 *
 * 구조:
 * - version (1B): 0x01
 * - count (4B): 게시물 수
 * - 게시물마다:
 *   - postId (4B len + UTF-8)
 *   - authorId (4B len + UTF-8)
 *   - timestamp (8B): epoch millis
 *   - likes / shares / comments (8B each)
 */
public final class PostTimelineCodec {
    public static final byte VERSION = 0x01;
    private static final int MAX_POSTS = 10_000;
    private static final int MAX_STRING_BYTES = 1024;

    private PostTimelineCodec() {
    }

    public static byte[] encode(List<PostCandidate> posts) {
        if (posts.size() > MAX_POSTS) {
            throw new CodecException("Too many posts: " + posts.size(), CodecException.INVALID_LENGTH);
        }

        ByteBuf buf = Unpooled.buffer(5 + posts.size() * 64);
        try {
            buf.writeByte(VERSION);
            buf.writeIntLE(posts.size());
            for (PostCandidate post : posts) {
                writeString(buf, post.postId());
                writeString(buf, post.authorId());
                buf.writeLongLE(post.timestamp().toEpochMilli());
                buf.writeLongLE(post.engagement().likes());
                buf.writeLongLE(post.engagement().shares());
                buf.writeLongLE(post.engagement().comments());
            }

            byte[] out = new byte[buf.readableBytes()];
            buf.readBytes(out);
            return out;
        } finally {
            buf.release();
        }
    }

    public static List<PostCandidate> decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new CodecException("Empty timeline record", CodecException.DECODE_ERROR);
        }

        ByteBuf buf = Unpooled.wrappedBuffer(data);
        try {
            byte version = buf.readByte();
            if (version != VERSION) {
                throw new CodecException("Unsupported timeline version: " + version, CodecException.UNSUPPORTED_VERSION);
            }

            int count = buf.readIntLE();
            if (count < 0 || count > MAX_POSTS) {
                throw new CodecException("Invalid post count: " + count, CodecException.INVALID_LENGTH);
            }

            List<PostCandidate> posts = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                String postId = readString(buf);
                String authorId = readString(buf);
                Instant timestamp = Instant.ofEpochMilli(buf.readLongLE());
                Engagement engagement = new Engagement(buf.readLongLE(), buf.readLongLE(), buf.readLongLE());
                posts.add(new PostCandidate(postId, authorId, timestamp, engagement));
            }

            if (buf.isReadable()) {
                throw new CodecException("Trailing bytes after timeline: " + buf.readableBytes(),
                                         CodecException.INVALID_LENGTH);
            }
            return Collections.unmodifiableList(posts);
        } catch (IndexOutOfBoundsException e) {
            throw new CodecException("Malformed timeline (buffer underflow)", CodecException.DECODE_ERROR, e);
        } catch (IllegalArgumentException e) {
            throw new CodecException("Malformed timeline: " + e.getMessage(), CodecException.DECODE_ERROR, e);
        } finally {
            buf.release();
        }
    }

    private static void writeString(ByteBuf buf, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_STRING_BYTES) {
            throw new CodecException("String too long: " + bytes.length, CodecException.INVALID_LENGTH);
        }
        buf.writeIntLE(bytes.length);
        buf.writeBytes(bytes);
    }

    private static String readString(ByteBuf buf) {
        int length = buf.readIntLE();
        if (length < 0 || length > MAX_STRING_BYTES) {
            throw new CodecException("Invalid string length: " + length, CodecException.INVALID_LENGTH);
        }
        byte[] bytes = new byte[length];
        buf.readBytes(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
