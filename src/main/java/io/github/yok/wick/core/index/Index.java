package io.github.yok.wick.core.index;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import lombok.Value;

/**
 * 第二量子化の添字（名前・軌道空間・真空）を表す不変クラスです。
 *
 * <p>
 * 軌道空間と真空の組み合わせは生成時に一度だけ検証します。
 * </p>
 */
@Value
public class Index {

    /**
     * 添字名です（例: p1, i, a）。
     */
    String name;

    /**
     * 軌道空間です。
     */
    Space space;

    /**
     * 真空です。
     */
    Vacuum vacuum;

    private Index(String name, Space space, Vacuum vacuum) {
        this.name = name;
        this.space = space;
        this.vacuum = vacuum;
    }

    /**
     * 添字を生成します。
     *
     * @param name 添字名です（null・空文字不可）
     * @param space 軌道空間です（null 不可）
     * @param vacuum 真空です（null 不可）
     * @return 添字です
     * @throws InvalidIndexException space が vacuum のもとで許可されない場合に発生します
     */
    public static Index of(String name, Space space, Vacuum vacuum) {
        checkNotNull(name, "name は null 不可です");
        checkArgument(!name.isEmpty(), "name は空文字不可です");
        checkNotNull(space, "space は null 不可です");
        checkNotNull(vacuum, "vacuum は null 不可です");
        if (!space.isAllowed(vacuum)) {
            throw new InvalidIndexException(name, space, vacuum);
        }
        return new Index(name, space, vacuum);
    }

    /**
     * 物理真空上の一般添字を生成します。
     *
     * @param name 添字名です
     * @return 添字です
     */
    public static Index general(String name) {
        return of(name, Space.GENERAL, Vacuum.PHYSICAL);
    }

    /**
     * 英数字以外を取り除いた添字名を返します（例: p_1 → p1）。
     *
     * @return 英数字のみの添字名です
     */
    public String alphanumericName() {
        StringBuilder sb = new StringBuilder(name.length());
        name.codePoints().filter(Character::isLetterOrDigit).forEach(sb::appendCodePoint);
        return sb.toString();
    }
}
