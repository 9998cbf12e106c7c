package my.journalsuggester.app.service;

import my.journalsuggester.app.model.Allocation;
import my.journalsuggester.app.model.Side;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class GreedyRoundingDecoder {
	private static final int SCALE = ShareNormalizer.SCALE;

	/**
	 * Splits {@code total} over the given shares with the largest-remainder method. Lines that would round to zero
	 * are removed by dropping the weakest non-forced candidate and re-running, so every returned amount is at least
	 * one. When only forced lines round to zero they take one unit each from the largest line instead.
	 */
	public List<Allocation> decodeSide(Side side, List<ShareNormalizer.Share> shares, long total) {
		if (shares == null || shares.isEmpty()) {
			throw new EmptyCandidateException(side, "Nothing to decode on the " + side.label() + " side");
		}
		if (total <= 0) {
			throw new InvalidTotalException(total);
		}
		List<ShareNormalizer.Share> remaining = new ArrayList<>(shares);
		while (true) {
			long[] amounts = roundByLargestRemainder(remaining, total);
			int zeroIndex = indexOfZero(amounts);
			if (zeroIndex >= 0 && remaining.size() > 1 && onlyForcedAreZero(remaining, amounts) && total >= remaining.size()) {
				liftZeros(amounts);
				zeroIndex = -1;
			}
			if (zeroIndex < 0 || remaining.size() == 1) {
				List<Allocation> lines = new ArrayList<>();
				for (int i = 0; i < remaining.size(); i++) {
					lines.add(new Allocation(remaining.get(i).accountId(), side, amounts[i]));
				}
				return List.copyOf(lines);
			}
			remaining.remove(weakestIndex(remaining));
		}
	}

	private void liftZeros(long[] amounts) {
		for (int i = 0; i < amounts.length; i++) {
			if (amounts[i] > 0) {
				continue;
			}
			int largest = 0;
			for (int j = 1; j < amounts.length; j++) {
				if (amounts[j] > amounts[largest]) {
					largest = j;
				}
			}
			amounts[largest] -= 1;
			amounts[i] = 1;
		}
	}

	private boolean onlyForcedAreZero(List<ShareNormalizer.Share> shares, long[] amounts) {
		for (int i = 0; i < amounts.length; i++) {
			if (amounts[i] <= 0 && !shares.get(i).forced()) {
				return false;
			}
		}
		return true;
	}

	long[] roundByLargestRemainder(List<ShareNormalizer.Share> shares, long total) {
		int size = shares.size();
		BigDecimal weightTotal = BigDecimal.ZERO;
		for (ShareNormalizer.Share share : shares) {
			weightTotal = weightTotal.add(share.value());
		}
		boolean uniform = weightTotal.signum() == 0;
		BigDecimal target = BigDecimal.valueOf(total);

		long[] rounded = new long[size];
		List<Remainder> remainders = new ArrayList<>();
		long sum = 0L;
		for (int i = 0; i < size; i++) {
			BigDecimal raw = uniform
					? target.divide(BigDecimal.valueOf(size), SCALE, RoundingMode.DOWN)
					: target.multiply(shares.get(i).value()).divide(weightTotal, SCALE, RoundingMode.DOWN);
			BigDecimal floor = raw.setScale(0, RoundingMode.FLOOR);
			rounded[i] = floor.longValueExact();
			remainders.add(new Remainder(i, raw.subtract(floor)));
			sum += rounded[i];
		}
		long drift = total - sum;
		if (drift > 0) {
			remainders.sort(Comparator.comparing(Remainder::fraction).reversed()
					.thenComparingInt(Remainder::index));
			int index = 0;
			while (drift > 0) {
				Remainder remainder = remainders.get(index % remainders.size());
				rounded[remainder.index()] += 1;
				drift -= 1;
				index += 1;
			}
		}
		return rounded;
	}

	private int indexOfZero(long[] amounts) {
		for (int i = 0; i < amounts.length; i++) {
			if (amounts[i] <= 0) {
				return i;
			}
		}
		return -1;
	}

	// shares arrive strongest first; forced lines go only once nothing else is left
	private int weakestIndex(List<ShareNormalizer.Share> shares) {
		for (int i = shares.size() - 1; i >= 0; i--) {
			if (!shares.get(i).forced()) {
				return i;
			}
		}
		return shares.size() - 1;
	}

	private record Remainder(int index, BigDecimal fraction) {
	}
}
