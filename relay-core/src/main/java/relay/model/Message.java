package relay.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable message crossing the boundary between a network account and the plugin layer.
 *
 * <p>The {@code id} is assigned by the store on insert and is {@code 0} for messages that
 * were never persisted. The {@code nonce} identifies the message across lanes: an outgoing
 * message and its echo in the incoming lane share the same nonce, which is what makes the
 * echo insert idempotent. A ULID nonce is generated when none is supplied.
 *
 * <p>Use {@link #builder()} to create instances and {@link #toBuilder()} to derive copies.
 */
public final class Message {
    public static final String PRIVMSG = "PRIVMSG";
    public static final String NOTICE = "NOTICE";
    public static final String PING = "PING";
    public static final String PONG = "PONG";
    public static final String QUIT = "QUIT";

    private final long id;
    private final String nonce;
    private final Lane lane;
    private final Instant time;
    private final String account;
    private final String channel;
    private final String nick;
    private final String user;
    private final String host;
    private final String command;
    private final List<String> params;
    private final String text;
    private final String botText;
    private final String bang;
    private final String asNick;

    private Message(Builder builder) {
        if (builder.id < 0) {
            throw new IllegalArgumentException("id must be >= 0, got: " + builder.id);
        }
        this.id = builder.id;
        this.nonce = isBlank(builder.nonce) ? newNonce() : builder.nonce;
        this.lane = builder.lane;
        this.time = builder.time == null ? Instant.now() : builder.time;
        this.account = Objects.requireNonNull(builder.account, "account");
        this.channel = orEmpty(builder.channel);
        this.nick = orEmpty(builder.nick);
        this.user = orEmpty(builder.user);
        this.host = orEmpty(builder.host);
        this.command = isBlank(builder.command) ? PRIVMSG : builder.command;
        this.params = builder.params == null ? List.of() : List.copyOf(builder.params);
        this.text = orEmpty(builder.text);
        this.botText = orEmpty(builder.botText);
        this.bang = orEmpty(builder.bang);
        this.asNick = orEmpty(builder.asNick);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with every field of this message.
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .nonce(nonce)
                .lane(lane)
                .time(time)
                .account(account)
                .channel(channel)
                .nick(nick)
                .user(user)
                .host(host)
                .command(command)
                .params(params)
                .text(text)
                .botText(botText)
                .bang(bang)
                .asNick(asNick);
    }

    /**
     * Returns a copy of this message as it is recorded in the incoming lane after delivery.
     * The id is cleared so the store assigns a fresh one; the nonce is preserved.
     */
    public Message asEcho() {
        return toBuilder().id(0).lane(Lane.INCOMING).build();
    }

    public long id() {
        return id;
    }

    public String nonce() {
        return nonce;
    }

    /** The lane this message was read from, or {@code null} if it was never stored. */
    public Lane lane() {
        return lane;
    }

    public Instant time() {
        return time;
    }

    public String account() {
        return account;
    }

    public String channel() {
        return channel;
    }

    public String nick() {
        return nick;
    }

    public String user() {
        return user;
    }

    public String host() {
        return host;
    }

    public String command() {
        return command;
    }

    public List<String> params() {
        return params;
    }

    public String text() {
        return text;
    }

    public String botText() {
        return botText;
    }

    public String bang() {
        return bang;
    }

    public String asNick() {
        return asNick;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message other)) return false;
        return id == other.id
                && nonce.equals(other.nonce)
                && lane == other.lane
                && account.equals(other.account);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, nonce, lane, account);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Message[id=").append(id)
                .append(", account=").append(account)
                .append(", command=").append(command);
        if (!channel.isEmpty()) sb.append(", channel=").append(channel);
        if (!nick.isEmpty()) sb.append(", nick=").append(nick);
        if (!params.isEmpty()) sb.append(", params=").append(params);
        if (!text.isEmpty()) sb.append(", text=").append(text);
        return sb.append(']').toString();
    }

    private static String newNonce() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isEmpty();
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }

    /**
     * Builder for {@link Message}. Only {@code account} is required.
     */
    public static final class Builder {
        private long id;
        private String nonce;
        private Lane lane;
        private Instant time;
        private String account;
        private String channel;
        private String nick;
        private String user;
        private String host;
        private String command;
        private List<String> params;
        private String text;
        private String botText;
        private String bang;
        private String asNick;

        private Builder() {
        }

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder nonce(String nonce) {
            this.nonce = nonce;
            return this;
        }

        public Builder lane(Lane lane) {
            this.lane = lane;
            return this;
        }

        public Builder time(Instant time) {
            this.time = time;
            return this;
        }

        public Builder account(String account) {
            this.account = account;
            return this;
        }

        public Builder channel(String channel) {
            this.channel = channel;
            return this;
        }

        public Builder nick(String nick) {
            this.nick = nick;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /** Protocol command; defaults to {@value Message#PRIVMSG}. */
        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder params(List<String> params) {
            this.params = params;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        /** Text addressed at the bot, with the bot nick or bang prefix stripped. */
        public Builder botText(String botText) {
            this.botText = botText;
            return this;
        }

        public Builder bang(String bang) {
            this.bang = bang;
            return this;
        }

        public Builder asNick(String asNick) {
            this.asNick = asNick;
            return this;
        }

        /**
         * @throws NullPointerException     if {@code account} is null
         * @throws IllegalArgumentException if {@code id} is negative
         */
        public Message build() {
            return new Message(this);
        }
    }
}
